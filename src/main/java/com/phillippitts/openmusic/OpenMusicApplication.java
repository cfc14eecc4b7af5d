package com.phillippitts.openmusic;

import com.phillippitts.openmusic.config.properties.CacheProperties;
import com.phillippitts.openmusic.config.properties.QueueProperties;
import com.phillippitts.openmusic.config.properties.ResolverProperties;
import com.phillippitts.openmusic.config.properties.SourceProperties;
import com.phillippitts.openmusic.config.source.ExtractorConfig;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableConfigurationProperties({
        ExtractorConfig.class,
        ResolverProperties.class,
        CacheProperties.class,
        QueueProperties.class,
        SourceProperties.class
})
@EnableScheduling
public class OpenMusicApplication {

    public static void main(String[] args) {
        SpringApplication.run(OpenMusicApplication.class, args);
    }

}
