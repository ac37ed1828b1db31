package com.phillippitts.coordination;

import com.phillippitts.coordination.config.properties.AdmissionProperties;
import com.phillippitts.coordination.config.properties.LearningProperties;
import com.phillippitts.coordination.config.properties.PlannerProperties;
import com.phillippitts.coordination.config.properties.StrategyProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

@SpringBootApplication
@EnableConfigurationProperties({
        AdmissionProperties.class,
        StrategyProperties.class,
        PlannerProperties.class,
        LearningProperties.class
})
public class CoordinationEngineApplication {

    public static void main(String[] args) {
        SpringApplication.run(CoordinationEngineApplication.class, args);
    }

}
