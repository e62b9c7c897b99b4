package com.openforge.numen;

import com.openforge.numen.memory.MilvusProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.scheduling.annotation.EnableScheduling;

// MilvusProperties registered here so the startup summary can read it
// whether or not the conditional Milvus beans are loaded.
@SpringBootApplication
@EnableScheduling
@EnableConfigurationProperties(MilvusProperties.class)
public class NumenApplication {

    public static void main(String[] args) {
        SpringApplication.run(NumenApplication.class, args);
    }
}
