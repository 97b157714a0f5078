package com.example.excelsplit;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class ExcelSplitApplication {

    public static void main(String[] args) {
        SpringApplication.run(ExcelSplitApplication.class, args);
    }
}
