package io.github.jakubt4.orrery.config;

import jakarta.annotation.PostConstruct;
import lombok.extern.slf4j.Slf4j;
import org.orekit.data.DataContext;
import org.orekit.data.ZipJarCrawler;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Configuration;

/**
 * Registers the Orekit data archive (JPL ephemerides, leap seconds, EOP) with
 * Orekit's {@link DataContext} when it is on the classpath.
 *
 * <p>The archive is only mandatory for {@code orrery.ephemeris.source=orekit};
 * the analytic ephemeris and the TT time scale work without it. Beans that read
 * Orekit data should inject this configuration to guarantee ordering.
 */
@Slf4j
@Configuration
public class OrekitConfig {

    @Value("${orrery.orekit.data:orekit-data.zip}")
    private String dataResource;

    @Value("${orrery.ephemeris.source:analytic}")
    private String ephemerisSource;

    /**
     * @throws IllegalStateException if Orekit ephemerides are selected and the
     *                               archive is not found on the classpath
     */
    @PostConstruct
    public void init() {
        final var orekitData = OrekitConfig.class.getClassLoader().getResource(dataResource);
        if (orekitData == null) {
            if (DynamicsConfig.OREKIT_EPHEMERIS.equalsIgnoreCase(ephemerisSource)) {
                throw new IllegalStateException(dataResource + " not found on classpath, required by orrery.ephemeris.source=orekit");
            }
            log.info("{} not on classpath — running Orekit data-free", dataResource);
            return;
        }
        final var crawler = new ZipJarCrawler(orekitData);
        DataContext.getDefault().getDataProvidersManager().addProvider(crawler);
        log.info("Orekit data loaded from classpath:{}", dataResource);
    }
}
