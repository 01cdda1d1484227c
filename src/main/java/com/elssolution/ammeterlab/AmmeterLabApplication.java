package com.elssolution.ammeterlab;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.context.ConfigurableApplicationContext;
import org.springframework.scheduling.annotation.EnableScheduling;

@EnableScheduling
@SpringBootApplication
public class AmmeterLabApplication {

    public static void main(String[] args) {
        ConfigurableApplicationContext ctx = SpringApplication.run(AmmeterLabApplication.class, args);
        // campaign mode: one campaign, then exit with its code
        if (ctx.getEnvironment().getProperty("lab.campaign.enabled", Boolean.class, false)) {
            System.exit(SpringApplication.exit(ctx));
        }
    }

}
