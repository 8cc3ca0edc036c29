package com.phillippitts.telesession;

import com.phillippitts.telesession.config.properties.ReconnectProperties;
import com.phillippitts.telesession.config.properties.SignalingProperties;
import com.phillippitts.telesession.config.properties.TelemetryProperties;
import com.phillippitts.telesession.config.properties.ThreadPoolProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableConfigurationProperties({
        ThreadPoolProperties.class,
        SignalingProperties.class,
        TelemetryProperties.class,
        ReconnectProperties.class
})
@EnableScheduling
public class TeleSessionApplication {

    public static void main(String[] args) {
        SpringApplication.run(TeleSessionApplication.class, args);
    }

}
