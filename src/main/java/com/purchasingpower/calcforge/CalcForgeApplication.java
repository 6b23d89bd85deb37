package com.purchasingpower.calcforge;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class CalcForgeApplication {

	public static void main(String[] args) {
		SpringApplication.run(CalcForgeApplication.class, args);
	}

}
