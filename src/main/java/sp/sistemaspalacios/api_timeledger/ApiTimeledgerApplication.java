package sp.sistemaspalacios.api_timeledger;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class ApiTimeledgerApplication {

	public static void main(String[] args) {
		SpringApplication.run(ApiTimeledgerApplication.class, args);
	}

}
