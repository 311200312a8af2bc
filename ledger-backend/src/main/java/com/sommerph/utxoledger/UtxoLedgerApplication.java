package com.sommerph.utxoledger;

import com.sommerph.utxoledger.config.LedgerProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

@SpringBootApplication
@EnableConfigurationProperties(LedgerProperties.class)
public class UtxoLedgerApplication {

	public static void main(String[] args) {
		SpringApplication.run(UtxoLedgerApplication.class, args);
	}

}
