package com.miniredis;

import com.miniredis.components.infra.ServerConfig;
import com.miniredis.components.repository.MonotonicClock;
import com.miniredis.components.server.TcpServer;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.context.ApplicationContext;
import org.springframework.context.annotation.Bean;
import org.springframework.scheduling.annotation.EnableScheduling;

@Slf4j
@EnableScheduling
@SpringBootApplication
public class Main {

    public static void main(String[] args) {
        SpringApplication.run(Main.class, args);
    }

    @Bean
    MonotonicClock monotonicClock() {
        return MonotonicClock.SYSTEM;
    }

    @Bean
    CommandLineRunner commandLineRunner(ApplicationContext context) {
        return args -> {
            TcpServer tcpServer = context.getBean(TcpServer.class);
            ServerConfig serverConfig = context.getBean(ServerConfig.class);

            serverConfig.applyArguments(args);
            log.info("Starting mini-redis with bind={} port={} max-conns={}",
                    serverConfig.getBind(), serverConfig.getPort(), serverConfig.getMaxConns());

            tcpServer.startServer();
        };
    }
}
