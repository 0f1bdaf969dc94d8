package io.mersel.ucdoc.infrastructure.config;

import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.ComponentScan;
import org.springframework.context.annotation.Configuration;

/**
 * Altyapı katmanı Spring yapılandırması.
 * <p>
 * Bu katmandaki tüm bileşenleri (YAML yükleyici, PICT adaptörü, karar tablosu motoru, metrikler)
 * otomatik tarar ve UCDoc yapılandırma özelliklerini etkinleştirir.
 */
@Configuration
@ComponentScan(basePackages = "io.mersel.ucdoc.infrastructure")
@EnableConfigurationProperties(UcdocProperties.class)
public class InfrastructureConfig {
}
