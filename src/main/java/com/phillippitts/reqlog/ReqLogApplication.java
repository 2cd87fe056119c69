package com.phillippitts.reqlog;

import com.phillippitts.reqlog.config.properties.RequestLoggingProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

@SpringBootApplication
@EnableConfigurationProperties(RequestLoggingProperties.class)
public class ReqLogApplication {

    public static void main(String[] args) {
        SpringApplication.run(ReqLogApplication.class, args);
    }

}
