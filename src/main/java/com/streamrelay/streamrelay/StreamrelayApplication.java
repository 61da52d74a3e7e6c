package com.streamrelay.streamrelay;

import org.bytedeco.javacv.FFmpegLogCallback;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;
import org.springframework.scheduling.annotation.EnableAsync;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@ConfigurationPropertiesScan
@EnableScheduling
@EnableAsync
public class StreamrelayApplication {

	public static void main(String[] args) {
		// Route FFmpeg messages from the recording probe through the JavaCV callback
		FFmpegLogCallback.set();

		SpringApplication.run(StreamrelayApplication.class, args);
	}

}
