package com.flagship.procurement_ledger.config;

import com.flagship.procurement_ledger.conversation.CostCenterCatalog;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.time.ZoneId;
import java.util.List;

/**
 * Domain settings: ledger time zone and the cost center catalog.
 */
@Configuration
@Slf4j
public class ProcurementConfig {

    /**
     * Clock for ledger timestamps. Cells hold local times of this zone.
     */
    @Bean
    public Clock ledgerClock(@Value("${procurement.zone-id:Europe/Berlin}") String zoneId) {
        return Clock.system(ZoneId.of(zoneId));
    }

    @Bean
    public CostCenterCatalog costCenterCatalog(
            @Value("${procurement.cost-centers:Lager,Stahlhalle,Bulli,HR,Finanzen,Produktion,Andere}")
            List<String> costCenters) {
        CostCenterCatalog catalog = new CostCenterCatalog(costCenters);
        log.info("Cost centers: {}", catalog.options());
        return catalog;
    }
}
