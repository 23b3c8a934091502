package ru.trainer.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.util.ArrayList;
import java.util.List;

@Data
@Configuration
@ConfigurationProperties(prefix = "trainer.catalog")
public class CatalogConfig {

    private List<Entry> exercises = new ArrayList<>();

    // id 0 means unassigned
    @Data
    public static class Entry {
        private int id;
        private String name;
        private String type;
        private String description;
    }
}
