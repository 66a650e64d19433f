package com.example.wormhole;

import com.example.wormhole.config.WormholeProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

@SpringBootApplication
@EnableConfigurationProperties(WormholeProperties.class)
public class WormholeApplication {

	public static void main(String[] args) {
		SpringApplication.run(WormholeApplication.class, args);
	}

}
