package com.guildauction;

import com.guildauction.config.AuctionProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.scheduling.annotation.EnableScheduling;

@EnableScheduling
@EnableConfigurationProperties(AuctionProperties.class)
@SpringBootApplication
public class GuildAuctionApplication {

	public static void main(String[] args) {
		SpringApplication.run(GuildAuctionApplication.class, args);
	}

}
