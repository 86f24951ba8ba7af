package com.signalmix.app.properties;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.LinkedHashMap;
import java.util.Map;

@Getter
@Setter
@ConfigurationProperties(prefix = "collaborator")
public class CollaboratorProperties {
    private int workers = 8;
    private Map<String, String> commands = new LinkedHashMap<>();
}
