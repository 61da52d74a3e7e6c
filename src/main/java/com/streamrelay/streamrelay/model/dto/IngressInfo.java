package com.streamrelay.streamrelay.model.dto;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

@Getter
@Setter
@AllArgsConstructor
@NoArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public class IngressInfo {
    @JsonAlias("ingress_id")
    private String ingressId;
    @JsonAlias("room_name")
    private String roomName;
    private String name;
    private String url;
    @JsonAlias("stream_key")
    private String streamKey;
    @JsonAlias("input_type")
    private String inputType;
}
