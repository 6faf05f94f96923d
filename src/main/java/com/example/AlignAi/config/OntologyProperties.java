package com.example.AlignAi.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "app.ontology")
public class OntologyProperties {

    private String location = "classpath:skills/ontology.json";

    public String getLocation() {
        return location;
    }

    public void setLocation(String location) {
        this.location = location;
    }
}
