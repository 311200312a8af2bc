package com.sommerph.utxoledger.service.ledger;

import com.sommerph.utxoledger.model.event.LedgerEvent;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

@Slf4j
@Component
public class LedgerEventLogger {

    @EventListener
    public void onLedgerEvent(LedgerEvent event) {
        log.info("Ledger event: {}", event);
    }

}
