package com.vidnyan.vbuilder;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * vbuilder - Verilog module integration tool.
 *
 * Parses module headers, wires instances into a generated top module and
 * keeps the project state inside the generated file.
 */
@SpringBootApplication
public class VbuilderApplication {

    public static void main(String[] args) {
        SpringApplication.run(VbuilderApplication.class, args);
    }
}
