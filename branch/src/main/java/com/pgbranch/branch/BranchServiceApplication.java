package com.pgbranch.branch;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.context.annotation.ComponentScan;

/**
 * Branch Service: Entry Point
 *
 * Branch/snapshot orchestration over one PostgreSQL server, driven from the command line.
 * Capture, audit and replay components come from the capture module.
 */
@SpringBootApplication
@ComponentScan(basePackages = {"com.pgbranch.branch", "com.pgbranch.capture"})
public class BranchServiceApplication {
    public static void main(String[] args) {
        System.exit(SpringApplication.exit(SpringApplication.run(BranchServiceApplication.class, args)));
    }
}
