package org.iceforge.tilecut.task;

import org.iceforge.tilecut.TilecutProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

@Configuration
public class TaskConfig {

    @Bean
    public ExecutorService cutoutTaskExecutor(TilecutProperties props) {
        int threads = Math.max(1, props.getMaxConcurrentTasks());
        return Executors.newFixedThreadPool(threads, r -> {
            Thread t = new Thread(r, "tilecut-task");
            t.setDaemon(true);
            return t;
        });
    }
}
