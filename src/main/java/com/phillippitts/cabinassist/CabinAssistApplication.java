package com.phillippitts.cabinassist;

import com.phillippitts.cabinassist.config.properties.ContextProperties;
import com.phillippitts.cabinassist.config.properties.ConversationProperties;
import com.phillippitts.cabinassist.config.properties.HealthProperties;
import com.phillippitts.cabinassist.config.properties.IntegrityProperties;
import com.phillippitts.cabinassist.config.properties.ProviderProperties;
import com.phillippitts.cabinassist.config.properties.RecoveryProperties;
import com.phillippitts.cabinassist.config.properties.ThreadPoolProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

@SpringBootApplication
@EnableConfigurationProperties({
        ThreadPoolProperties.class,
        ContextProperties.class,
        HealthProperties.class,
        RecoveryProperties.class,
        ConversationProperties.class,
        ProviderProperties.class,
        IntegrityProperties.class
})
public class CabinAssistApplication {

    public static void main(String[] args) {
        SpringApplication.run(CabinAssistApplication.class, args);
    }

}
