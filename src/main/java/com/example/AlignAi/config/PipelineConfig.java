package com.example.AlignAi.config;

import com.example.AlignAi.service.SkillOntology;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.io.Resource;
import org.springframework.core.io.ResourceLoader;

import java.io.IOException;
import java.io.InputStream;

@Configuration
@EnableConfigurationProperties({ScoringProperties.class, OntologyProperties.class, UploadProperties.class})
public class PipelineConfig {

    private static final Logger log = LoggerFactory.getLogger(PipelineConfig.class);

    @Bean
    public SkillOntology skillOntology(OntologyProperties props, ResourceLoader resourceLoader, ObjectMapper objectMapper)
            throws IOException {
        Resource resource = resourceLoader.getResource(props.getLocation());
        if (!resource.exists()) {
            throw new IllegalStateException("Skill ontology not found: " + props.getLocation());
        }
        try (InputStream in = resource.getInputStream()) {
            SkillOntology ontology = SkillOntology.load(in, objectMapper);
            log.info("Skill ontology loaded: version={} skills={} location={}",
                    ontology.version(), ontology.size(), props.getLocation());
            return ontology;
        }
    }
}
