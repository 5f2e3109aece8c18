package dev.aparikh.scanerrors;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class ScanErrorsApplication {

    public static void main(String[] args) {
        SpringApplication.run(ScanErrorsApplication.class, args);
    }
}
