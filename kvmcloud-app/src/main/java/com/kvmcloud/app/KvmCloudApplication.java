package com.kvmcloud.app;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.context.annotation.ComponentScan;

/**
 * KVM cloud signaling broker entry point.
 */
@SpringBootApplication
@ComponentScan(basePackages = "com.kvmcloud")
public class KvmCloudApplication {

    public static void main(String[] args) {
        SpringApplication.run(KvmCloudApplication.class, args);
    }
}
