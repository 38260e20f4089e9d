package me.jling.gpstime;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class GpsTimeCheckApplication {

    public static void main(String[] args) {
        System.exit(SpringApplication.exit(SpringApplication.run(GpsTimeCheckApplication.class, args)));
    }
}
