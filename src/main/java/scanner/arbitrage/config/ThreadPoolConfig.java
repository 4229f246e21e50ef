package scanner.arbitrage.config;

import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.concurrent.Executor;
import java.util.concurrent.Executors;

@Configuration
@ConditionalOnProperty(name = "storage.enabled", havingValue = "true")
public class ThreadPoolConfig {

    // JDBC calls are blocking and must stay off the reactor threads
    @Bean(name = "jdbcExecutor")
    public Executor jdbcExecutor() {
        return Executors.newCachedThreadPool();
    }
}
