package com.gamecatalog.dumpimport;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class DumpImportApplication {

    public static void main(String[] args) {
        SpringApplication.run(DumpImportApplication.class, args);
    }
}
