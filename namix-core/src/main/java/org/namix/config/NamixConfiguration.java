package org.namix.config;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Data;

import java.util.HashMap;
import java.util.Map;

@Data
@JsonIgnoreProperties(ignoreUnknown = true)
public class NamixConfiguration {

    /**
     * 프로파일별 설정 맵
     */
    @JsonProperty("profiles")
    private Map<String, ProfileConfiguration> profiles = new HashMap<>();

    /**
     * 개별 프로파일 설정
     */
    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class ProfileConfiguration {

        @JsonProperty("naming")
        private NamingConfiguration naming;

        @JsonProperty("model")
        private ModelConfiguration model;
    }

    /**
     * 네이밍 관련 설정
     */
    @Data
    public static class NamingConfiguration {

        @JsonProperty("convention")
        private String convention;

        @JsonProperty("locale")
        private String locale;

        @JsonProperty("maxLength")
        private Integer maxLength;
    }

    /**
     * 모델 기본값 설정
     */
    @Data
    public static class ModelConfiguration {

        @JsonProperty("defaultSchema")
        private String defaultSchema;
    }
}
