package com.shannon;

import org.springframework.boot.ExitCodeGenerator;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.builder.SpringApplicationBuilder;
import org.springframework.context.ApplicationContext;

@SpringBootApplication
public class ShannonApplication {

    public static void main(String[] args) {
        ApplicationContext ctx = new SpringApplicationBuilder(ShannonApplication.class)
                .properties(
                        "spring.main.web-application-type=none",
                        "spring.main.banner-mode=off"
                )
                .run(args);

        // CLI app: exit with the command's status once it returns
        ExitCodeGenerator exitCodeGen = ctx.getBean(ExitCodeGenerator.class);
        System.exit(SpringApplication.exit(ctx, exitCodeGen));
    }
}
