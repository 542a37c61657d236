package com.kvmcloud.app.config;

import com.kvmcloud.app.directory.InMemoryDeviceDirectory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Wires the in-memory reference directory as both the device directory and
 * the identity service of the broker.
 */
@Configuration
public class DirectoryConfig {

    @Value("${kvmcloud.directory.devices:}")
    private String devices;
    @Value("${kvmcloud.identity.clients:}")
    private String clients;

    @Bean
    public InMemoryDeviceDirectory inMemoryDeviceDirectory() {
        return InMemoryDeviceDirectory.fromConfig(devices, clients);
    }
}
