package com.garment.materials;

import com.garment.materials.config.MaterialsProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

@SpringBootApplication
@EnableConfigurationProperties(MaterialsProperties.class)
public class GarmentMaterialsApplication {

	public static void main(String[] args) {
		SpringApplication.run(GarmentMaterialsApplication.class, args);
	}

}
