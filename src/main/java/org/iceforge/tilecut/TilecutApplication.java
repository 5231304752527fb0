package org.iceforge.tilecut;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

@SpringBootApplication
@EnableConfigurationProperties({TilecutProperties.class})
public class TilecutApplication {

	public static void main(String[] args) {
		SpringApplication.run(TilecutApplication.class, args);
	}
}
