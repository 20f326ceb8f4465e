package sk.pcola.paddles;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class PaddlePipelineApplication {

    public static void main(String[] args) {
        SpringApplication.run(PaddlePipelineApplication.class, args);
    }
}
