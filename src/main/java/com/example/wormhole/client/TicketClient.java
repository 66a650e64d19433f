package com.example.wormhole.client;

import com.example.wormhole.model.Ticket;

import java.util.List;

/**
 * Files work items for submitted pairs.
 */
public interface TicketClient {

    /**
     * @throws TicketFilingException when the ticket cannot be created
     */
    Ticket fileTicket(String title, String body, List<String> labels);
}
