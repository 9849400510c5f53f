package com.yoursp.faceapproval;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class FaceApprovalApplication {

    public static void main(String[] args) {
        SpringApplication.run(FaceApprovalApplication.class, args);
    }
}
