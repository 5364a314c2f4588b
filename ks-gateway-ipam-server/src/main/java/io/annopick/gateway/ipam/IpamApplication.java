package io.annopick.gateway.ipam;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling
public class IpamApplication {

    public static void main(String[] args) {
        SpringApplication.run(IpamApplication.class, args);
    }
}
