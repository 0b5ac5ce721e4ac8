// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.scry.search.filter;

import static sh.scry.core.query.Criterion.and;
import static sh.scry.core.query.Criterion.contains;
import static sh.scry.core.query.Criterion.containsNoCase;
import static sh.scry.core.query.Criterion.eq;
import static sh.scry.core.query.Criterion.gt;
import static sh.scry.core.query.Criterion.gte;
import static sh.scry.core.query.Criterion.in;
import static sh.scry.core.query.Criterion.isNull;
import static sh.scry.core.query.Criterion.lte;
import static sh.scry.core.query.Criterion.notNull;
import static sh.scry.core.query.Criterion.or;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.function.Function;
import java.util.function.Predicate;

import org.jspecify.annotations.Nullable;

import sh.scry.core.model.SearchFilters;
import sh.scry.core.query.Criterion;

/**
 * Every {@link SearchFilters} field, with the stage that evaluates it and, for
 * push-down fields, the predicate it contributes.
 *
 * <p>Predicates use the canonical schema; renames for older deployments are
 * applied later by the backend client.
 */
public enum FilterField {
    KEYWORD(FilterRoute.SEMANTIC, SearchFilters::hasKeyword),
    CHAINS(FilterRoute.CHAINS, f -> f.chains() != null),
    AGENT_IDS(FilterRoute.CANDIDATE_IDS, f -> f.agentIds() != null),
    METADATA(FilterRoute.METADATA_PREFILTER, f -> f.metadataKey() != null),
    FEEDBACK_SCAN(FilterRoute.FEEDBACK_PREFILTER, f -> f.feedback() != null && f.feedback().requiresScan()),

    /** Always present: agents must have a registration file unless explicitly asked otherwise. */
    HAS_REGISTRATION_FILE(f -> true, f -> Boolean.FALSE.equals(f.hasRegistrationFile())
            ? isNull(Paths.REGISTRATION_FILE)
            : notNull(Paths.REGISTRATION_FILE)),
    WALLET_ADDRESS(f -> notBlank(f.walletAddress()), f -> eq("agentWallet", lower(f.walletAddress()))),
    FEEDBACK_EXISTENCE(f -> f.feedback() != null && f.feedback().isExistenceOnly(), f -> gt("totalFeedback", "0")),
    OWNERS(f -> f.owners() != null, f -> in("owner", lower(f.owners()))),
    OPERATORS(f -> f.operators() != null, f -> anyOf("operators", lower(f.operators()))),
    REGISTERED_AT_FROM(f -> f.registeredAtFrom() != null,
            f -> gte("createdAt", DateBounds.toEpochSeconds("registeredAtFrom", f.registeredAtFrom()))),
    REGISTERED_AT_TO(f -> f.registeredAtTo() != null,
            f -> lte("createdAt", DateBounds.toEpochSeconds("registeredAtTo", f.registeredAtTo()))),
    UPDATED_AT_FROM(f -> f.updatedAtFrom() != null,
            f -> gte("updatedAt", DateBounds.toEpochSeconds("updatedAtFrom", f.updatedAtFrom()))),
    UPDATED_AT_TO(f -> f.updatedAtTo() != null,
            f -> lte("updatedAt", DateBounds.toEpochSeconds("updatedAtTo", f.updatedAtTo()))),

    NAME(f -> notBlank(f.name()), f -> containsNoCase(Paths.file("name"), f.name())),
    DESCRIPTION(f -> notBlank(f.description()), f -> containsNoCase(Paths.file("description"), f.description())),
    ENS_CONTAINS(f -> notBlank(f.ensContains()), f -> containsNoCase(Paths.file("ens"), f.ensContains())),
    DID_CONTAINS(f -> notBlank(f.didContains()), f -> containsNoCase(Paths.file("did"), f.didContains())),
    ACTIVE(f -> f.active() != null, f -> eq(Paths.file("active"), f.active())),
    X402_SUPPORT(f -> f.x402Support() != null, f -> eq(Paths.file("x402Support"), f.x402Support())),
    HAS_MCP(f -> f.hasMcp() != null, f -> presence("mcpEndpoint", f.hasMcp())),
    HAS_A2A(f -> f.hasA2a() != null, f -> presence("a2aEndpoint", f.hasA2a())),
    HAS_WEB(f -> f.hasWeb() != null, f -> presence("webEndpoint", f.hasWeb())),
    HAS_OASF(f -> f.hasOasf() != null, f -> eq(Paths.file("hasOASF"), f.hasOasf())),
    MCP_CONTAINS(f -> notBlank(f.mcpContains()), f -> containsNoCase(Paths.file("mcpEndpoint"), f.mcpContains())),
    A2A_CONTAINS(f -> notBlank(f.a2aContains()), f -> containsNoCase(Paths.file("a2aEndpoint"), f.a2aContains())),
    WEB_CONTAINS(f -> notBlank(f.webContains()), f -> containsNoCase(Paths.file("webEndpoint"), f.webContains())),

    SUPPORTED_TRUST(f -> f.supportedTrust() != null, f -> anyOf(Paths.file("supportedTrusts"), f.supportedTrust())),
    A2A_SKILLS(f -> f.a2aSkills() != null, f -> anyOf(Paths.file("a2aSkills"), f.a2aSkills())),
    MCP_TOOLS(f -> f.mcpTools() != null, f -> anyOf(Paths.file("mcpTools"), f.mcpTools())),
    MCP_PROMPTS(f -> f.mcpPrompts() != null, f -> anyOf(Paths.file("mcpPrompts"), f.mcpPrompts())),
    MCP_RESOURCES(f -> f.mcpResources() != null, f -> anyOf(Paths.file("mcpResources"), f.mcpResources())),
    OASF_SKILLS(f -> f.oasfSkills() != null, f -> anyOf(Paths.file("oasfSkills"), f.oasfSkills())),
    OASF_DOMAINS(f -> f.oasfDomains() != null, f -> anyOf(Paths.file("oasfDomains"), f.oasfDomains())),
    HAS_ENDPOINTS(f -> f.hasEndpoints() != null, f -> Boolean.TRUE.equals(f.hasEndpoints())
            ? or(notNull(Paths.file("webEndpoint")), notNull(Paths.file("mcpEndpoint")), notNull(Paths.file("a2aEndpoint")))
            : and(isNull(Paths.file("webEndpoint")), isNull(Paths.file("mcpEndpoint")), isNull(Paths.file("a2aEndpoint"))));

    private final FilterRoute route;
    private final Predicate<SearchFilters> present;
    private final @Nullable Function<SearchFilters, Criterion> predicate;

    FilterField(final FilterRoute route, final Predicate<SearchFilters> present) {
        this.route = route;
        this.present = present;
        this.predicate = null;
    }

    FilterField(final Predicate<SearchFilters> present, final Function<SearchFilters, Criterion> predicate) {
        this.route = FilterRoute.PUSHDOWN;
        this.present = present;
        this.predicate = predicate;
    }

    public FilterRoute route() {
        return route;
    }

    public boolean isPresent(final SearchFilters filters) {
        return present.test(filters);
    }

    /**
     * @return the predicate this field contributes, empty when it is absent or not a push-down field
     */
    public Optional<Criterion> pushdown(final SearchFilters filters) {
        if (predicate == null || !isPresent(filters)) {
            return Optional.empty();
        }
        return Optional.of(predicate.apply(filters));
    }

    private static final class Paths {
        static final String REGISTRATION_FILE = "registrationFile";

        static String file(final String field) {
            return REGISTRATION_FILE + "." + field;
        }
    }

    private static Criterion presence(final String endpoint, final Boolean wanted) {
        return wanted ? notNull(Paths.file(endpoint)) : isNull(Paths.file(endpoint));
    }

    private static Criterion anyOf(final String path, final List<String> values) {
        final List<Criterion> alternatives = new ArrayList<>(values.size());
        for (String value : values) {
            alternatives.add(contains(path, value));
        }
        return or(alternatives);
    }

    private static boolean notBlank(final @Nullable String value) {
        return value != null && !value.isBlank();
    }

    private static String lower(final String value) {
        return value.toLowerCase(Locale.ROOT);
    }

    private static List<String> lower(final List<String> values) {
        final List<String> out = new ArrayList<>(values.size());
        for (String value : values) {
            out.add(value.toLowerCase(Locale.ROOT));
        }
        return out;
    }
}
