package io.leavesfly.meer;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Meer 启动类
 */
@SpringBootApplication
public class MeerApplication {

    public static void main(String[] args) {
        SpringApplication application = new SpringApplication(MeerApplication.class);
        System.exit(SpringApplication.exit(application.run(args)));
    }
}
