package com.example.wormhole.client;

import com.example.wormhole.config.WormholeProperties;
import com.example.wormhole.model.Ticket;
import com.fasterxml.jackson.databind.JsonNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Service;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;

import java.util.List;
import java.util.Map;

/**
 * Files submissions as GitHub issues; the verification workflow picks them up from there.
 */
@Service
public class GitHubIssueClient implements TicketClient {

    private static final Logger log = LoggerFactory.getLogger(GitHubIssueClient.class);

    private final RestClient restClient;
    private final String owner;
    private final String repo;

    public GitHubIssueClient(WormholeProperties properties, RestClient.Builder restClientBuilder) {
        WormholeProperties.Submission submission = properties.submission();
        this.owner = submission.ticketOwner();
        this.repo = submission.ticketRepo();

        RestClient.Builder builder = restClientBuilder
                .baseUrl(submission.ticketBaseUrl())
                .defaultHeader(HttpHeaders.ACCEPT, "application/vnd.github+json");
        if (submission.ticketToken() != null && !submission.ticketToken().isBlank()) {
            builder = builder.defaultHeader(HttpHeaders.AUTHORIZATION, "Bearer " + submission.ticketToken());
        }
        this.restClient = builder.build();
    }

    @Override
    public Ticket fileTicket(String title, String body, List<String> labels) {
        try {
            JsonNode issue = restClient.post()
                    .uri("/repos/{owner}/{repo}/issues", owner, repo)
                    .contentType(MediaType.APPLICATION_JSON)
                    .body(Map.of("title", title, "body", body, "labels", labels))
                    .retrieve()
                    .body(JsonNode.class);
            if (issue == null || !issue.has("number")) {
                throw new TicketFilingException("GitHub returned no issue for '" + title + "'", null);
            }
            Ticket ticket = new Ticket(issue.path("number").asInt(), issue.path("html_url").asText());
            log.info("Filed issue #{} ({})", ticket.number(), ticket.url());
            return ticket;
        } catch (RestClientException e) {
            throw new TicketFilingException("Failed to create GitHub issue: " + e.getMessage(), e);
        }
    }
}
