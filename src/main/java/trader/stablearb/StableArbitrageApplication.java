package trader.stablearb;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.autoconfigure.jdbc.DataSourceAutoConfiguration;
import org.springframework.scheduling.annotation.EnableScheduling;

// the ClickHouse data source is declared by hand and only when enabled
@SpringBootApplication(exclude = DataSourceAutoConfiguration.class)
@EnableScheduling
public class StableArbitrageApplication {

    public static void main(String[] args) {
        SpringApplication.run(StableArbitrageApplication.class, args);
    }
}
