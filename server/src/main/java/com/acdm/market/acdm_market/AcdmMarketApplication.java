package com.acdm.market.acdm_market;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class AcdmMarketApplication {

	public static void main(String[] args) {
		SpringApplication.run(AcdmMarketApplication.class, args);
	}

}
