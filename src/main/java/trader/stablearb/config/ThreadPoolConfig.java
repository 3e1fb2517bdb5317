package trader.stablearb.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

@Configuration
public class ThreadPoolConfig {

    @Bean(name = "jdbcExecutor", destroyMethod = "shutdown")
    public ExecutorService jdbcExecutor() {
        return Executors.newCachedThreadPool();
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }
}
