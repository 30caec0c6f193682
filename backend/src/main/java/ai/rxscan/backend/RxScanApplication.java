package ai.rxscan.backend;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class RxScanApplication {

    public static void main(String[] args) {
        SpringApplication.run(RxScanApplication.class, args);
    }
}
