package com.csd.packagefinder.cli;

import com.csd.packagefinder.PackageFinderApplication;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.WebApplicationType;
import org.springframework.boot.builder.SpringApplicationBuilder;
import org.springframework.context.ConfigurableApplicationContext;

/**
 * Command line entry point. Starts the application without a web server and runs one search.
 */
public final class PackageFinderCli {

    private PackageFinderCli() {}

    public static void main(String[] args) {
        ConfigurableApplicationContext context = new SpringApplicationBuilder(PackageFinderApplication.class)
                .web(WebApplicationType.NONE)
                .logStartupInfo(false)
                .properties(
                        "packagefinder.cli.enabled=true",
                        "spring.main.banner-mode=off",
                        // keep stdout clean for json/csv output
                        "logging.level.root=ERROR")
                .run(args);
        System.exit(SpringApplication.exit(context));
    }
}
