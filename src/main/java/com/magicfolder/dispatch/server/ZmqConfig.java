package com.magicfolder.dispatch.server;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.zeromq.ZContext;

@Configuration
public class ZmqConfig {

    @Bean(destroyMethod = "close")
    public ZContext zContext() {
        return new ZContext();
    }
}
