package com.lyncx;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.autoconfigure.security.servlet.UserDetailsServiceAutoConfiguration;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication(exclude = UserDetailsServiceAutoConfiguration.class)
@ConfigurationPropertiesScan({"com.lyncx.auth.config", "com.lyncx.store.firestore"})
public class LyncxApiApplication {

    public static void main(String[] args) {
        SpringApplication.run(LyncxApiApplication.class, args);
    }
}
