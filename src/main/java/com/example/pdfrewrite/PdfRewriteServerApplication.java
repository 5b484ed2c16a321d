package com.example.pdfrewrite;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class PdfRewriteServerApplication {

    public static void main(String[] args) {
        SpringApplication.run(PdfRewriteServerApplication.class, args);
    }

}
