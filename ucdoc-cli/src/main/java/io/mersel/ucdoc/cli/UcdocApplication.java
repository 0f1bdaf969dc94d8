package io.mersel.ucdoc.cli;

import io.mersel.ucdoc.infrastructure.config.InfrastructureConfig;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.WebApplicationType;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.context.annotation.Import;

/**
 * MERSEL UCDoc - Komut satırı giriş noktası.
 * <p>
 * Kullanım senaryosu tanımlarından kombinasyon tablosu, karar tablosu ve
 * senaryo test dokümanı üretir.
 */
@SpringBootApplication
@Import(InfrastructureConfig.class)
public class UcdocApplication {

    public static void main(String[] args) {
        SpringApplication application = new SpringApplication(UcdocApplication.class);
        application.setWebApplicationType(WebApplicationType.NONE);
        System.exit(SpringApplication.exit(application.run(args)));
    }
}
