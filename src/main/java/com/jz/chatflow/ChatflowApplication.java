package com.jz.chatflow;


import org.mybatis.spring.annotation.MapperScan;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;
import org.springframework.cache.annotation.EnableCaching;


@EnableCaching
@SpringBootApplication
@MapperScan("com.jz.chatflow.mapper")
@ConfigurationPropertiesScan(basePackages = "com.jz.chatflow")
public class ChatflowApplication {
    public static void main(String[] args) {
        SpringApplication.run(ChatflowApplication.class, args);
    }
}
