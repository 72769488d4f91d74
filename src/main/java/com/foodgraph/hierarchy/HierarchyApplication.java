package com.foodgraph.hierarchy;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class HierarchyApplication {

    public static void main(String[] args) {
        System.exit(SpringApplication.exit(SpringApplication.run(HierarchyApplication.class, args)));
    }
}
