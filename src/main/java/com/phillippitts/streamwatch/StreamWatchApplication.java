package com.phillippitts.streamwatch;

import com.phillippitts.streamwatch.config.properties.FfmpegProperties;
import com.phillippitts.streamwatch.config.properties.ReconnectProperties;
import com.phillippitts.streamwatch.config.properties.StreamProperties;
import com.phillippitts.streamwatch.config.properties.ThreadPoolProperties;
import com.phillippitts.streamwatch.config.properties.WatchdogProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableConfigurationProperties({
        WatchdogProperties.class,
        ReconnectProperties.class,
        StreamProperties.class,
        FfmpegProperties.class,
        ThreadPoolProperties.class
})
@EnableScheduling
public class StreamWatchApplication {

    public static void main(String[] args) {
        SpringApplication.run(StreamWatchApplication.class, args);
    }

}
