package dao.whalevault.relay;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling
public class WhaleVaultRelayApplication {

    public static void main(String[] args) {
        SpringApplication.run(WhaleVaultRelayApplication.class, args);
    }
}
