package blitz.engine;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class BlitzEngineApplication {

    public static void main(String[] args) {
        SpringApplication.run(BlitzEngineApplication.class, args);
    }

}
