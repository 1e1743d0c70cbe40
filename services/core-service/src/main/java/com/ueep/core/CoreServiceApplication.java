package com.ueep.core;

import com.ueep.core.config.DataProperties;
import com.ueep.core.config.ResilienceProperties;
import com.ueep.core.config.ServiceProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

@SpringBootApplication
@EnableConfigurationProperties({ResilienceProperties.class, DataProperties.class, ServiceProperties.class})
public class CoreServiceApplication {
    public static void main(String[] args) {
        SpringApplication.run(CoreServiceApplication.class, args);
    }
}
