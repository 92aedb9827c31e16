package com.example.pdfconvert;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class PdfConvertApplication {

    public static void main(String[] args) {
        SpringApplication.run(PdfConvertApplication.class, args);
    }
}
