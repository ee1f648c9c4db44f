package com.tallyInsight.reportChat;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class ReportChatApplication {

    public static void main(String[] args) {
        SpringApplication.run(ReportChatApplication.class, args);
    }
}
