package com.example.wormhole.model;

/**
 * Work item filed for a submission.
 *
 * @param number ticket number
 * @param url    browsable ticket URL
 */
public record Ticket(int number, String url) {}
