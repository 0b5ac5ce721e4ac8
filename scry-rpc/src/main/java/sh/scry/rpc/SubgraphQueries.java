// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.scry.rpc;

import java.util.List;

/**
 * GraphQL documents for the ERC-8004 subgraph, rendered against a {@link SchemaProfile}.
 */
final class SubgraphQueries {

    static final String SEARCH_AGENTS = "SearchAgents";
    static final String AGENT_METADATA = "AgentMetadata";
    static final String FEEDBACK_ROWS = "FeedbackRows";
    static final String SEARCH_FEEDBACK = "SearchFeedback";
    static final String AGENT_BY_ID = "AgentById";
    static final String FEEDBACK_BY_ID = "FeedbackById";
    static final String SCHEMA_PROBE = "SchemaProbe";

    private static final List<String> AGENT_FIELDS = List.of(
            "id", "chainId", "agentId", "agentURI", "agentURIType", "owner", "operators", "agentWallet",
            "totalFeedback", "createdAt", "updatedAt", "lastActivity");

    private static final List<String> REGISTRATION_FILE_FIELDS = List.of(
            "id", "name", "description", "image", "active", "x402Support", "supportedTrusts",
            "mcpEndpoint", "mcpVersion", "a2aEndpoint", "a2aVersion", "webEndpoint", "emailEndpoint",
            "hasOASF", "oasfSkills", "oasfDomains", "ens", "did", "agentWallet", "agentWalletChainId",
            "mcpTools", "mcpPrompts", "mcpResources", "a2aSkills", "createdAt");

    private static final List<String> RESPONSE_FIELDS = List.of("id", "responder", "responseURI", "createdAt");

    private static final String FEEDBACK_DETAIL = """
            id
            agent { id }
            clientAddress
            feedbackIndex
            value
            tag1
            tag2
            endpoint
            feedbackURI
            isRevoked
            createdAt
            feedbackFile { text capability name skill task }
            responses { %s }
            """;

    static final String SCHEMA_PROBE_QUERY = """
            query SchemaProbe {
              queryType: __type(name: "Query") { fields { name } }
              agent: __type(name: "Agent") { fields { name } }
              registrationFile: __type(name: "AgentRegistrationFile") { fields { name } }
              registrationFileFilter: __type(name: "AgentRegistrationFile_filter") { inputFields { name } }
              feedbackResponse: __type(name: "FeedbackResponse") { fields { name } }
            }
            """;

    private SubgraphQueries() {
    }

    static String searchAgents(SchemaProfile profile) {
        return """
                query SearchAgents($where: Agent_filter, $first: Int!, $skip: Int!, \
                $orderBy: Agent_orderBy, $orderDirection: OrderDirection) {
                  agents(where: $where, first: $first, skip: $skip, orderBy: $orderBy, orderDirection: $orderDirection) {
                    %s
                  }
                }
                """.formatted(agentSelection(profile));
    }

    static String agentById(SchemaProfile profile) {
        return """
                query AgentById($id: ID!) {
                  agent(id: $id) {
                    %s
                  }
                }
                """.formatted(agentSelection(profile));
    }

    static String agentMetadata(SchemaProfile profile) {
        final String collection = profile.field("Query", "agentMetadatas").orElse("agentMetadatas");
        return """
                query AgentMetadata($where: AgentMetadata_filter, $first: Int!, $skip: Int!) {
                  rows: %s(where: $where, first: $first, skip: $skip) {
                    id key value updatedAt agent { id }
                  }
                }
                """.formatted(collection);
    }

    static String feedbackRows() {
        return """
                query FeedbackRows($where: Feedback_filter, $first: Int!, $skip: Int!) {
                  feedbacks(where: $where, first: $first, skip: $skip, orderBy: createdAt, orderDirection: desc) {
                    id agent { id } clientAddress value tag1 tag2 endpoint isRevoked createdAt
                    responses(first: 1) { id }
                  }
                }
                """;
    }

    static String searchFeedback(SchemaProfile profile) {
        return """
                query SearchFeedback($where: Feedback_filter, $first: Int!, $skip: Int!) {
                  feedbacks(where: $where, first: $first, skip: $skip, orderBy: createdAt, orderDirection: desc) {
                    %s
                  }
                }
                """.formatted(FEEDBACK_DETAIL.formatted(responseSelection(profile)));
    }

    static String feedbackById(SchemaProfile profile) {
        return """
                query FeedbackById($id: ID!) {
                  feedback(id: $id) {
                    %s
                  }
                }
                """.formatted(FEEDBACK_DETAIL.formatted(responseSelection(profile)));
    }

    private static String agentSelection(SchemaProfile profile) {
        return profile.selection("Agent", AGENT_FIELDS)
                + " registrationFile { "
                + profile.selection("AgentRegistrationFile", REGISTRATION_FILE_FIELDS)
                + " }";
    }

    private static String responseSelection(SchemaProfile profile) {
        return profile.selection("FeedbackResponse", RESPONSE_FIELDS);
    }
}
