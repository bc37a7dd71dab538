package io.github.riemr.committee;

import org.mybatis.spring.annotation.MapperScan;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
@MapperScan("io.github.riemr.committee.infrastructure.mapper")
public class CommitteeSchedulerApplication {
    public static void main(String[] args) {
        SpringApplication.run(CommitteeSchedulerApplication.class, args);
    }
}
