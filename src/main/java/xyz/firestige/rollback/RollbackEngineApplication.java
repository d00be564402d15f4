package xyz.firestige.rollback;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class RollbackEngineApplication {

    public static void main(String[] args) {
        SpringApplication.run(RollbackEngineApplication.class, args);
    }
}
