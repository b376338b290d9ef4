package com.demo.chat;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class ChatBrokerApplication {

    public static void main(String[] args) {
        SpringApplication.run(ChatBrokerApplication.class, args);
    }
}
