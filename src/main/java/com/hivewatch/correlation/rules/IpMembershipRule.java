package com.hivewatch.correlation.rules;

import com.hivewatch.domain.ReputationVerdict;
import com.hivewatch.domain.RuleDefinition;
import com.hivewatch.enrichment.CidrBlock;

import java.util.ArrayList;
import java.util.List;

/**
 * Source-address membership.
 *
 * Parameters: {@code blacklist} and {@code whitelist} (addresses or CIDR blocks),
 * {@code reputation} (true to match addresses listed by a threat feed) and
 * {@code min_confidence} for feed hits. Whitelisted addresses never match, and the engine
 * suppresses alerting for their sessions entirely.
 */
public class IpMembershipRule extends CompiledRule {

    private final List<CidrBlock> blacklist;
    private final List<CidrBlock> whitelist;
    private final boolean useReputation;
    private final int minConfidence;

    public IpMembershipRule(RuleDefinition definition) {
        super(definition);
        RuleParameters params = new RuleParameters(definition);
        this.blacklist = parseBlocks(params.strings("blacklist"));
        this.whitelist = parseBlocks(params.strings("whitelist"));
        this.useReputation = params.bool("reputation", false);
        this.minConfidence = params.integer("min_confidence", 0);
    }

    @Override
    public boolean matches(EvaluationContext context) {
        String ip = context.getSourceIp();
        if (ip == null || isWhitelisted(ip)) {
            return false;
        }
        for (CidrBlock block : blacklist) {
            if (block.contains(ip)) {
                return true;
            }
        }
        if (useReputation) {
            ReputationVerdict verdict = context.getReputation();
            return verdict.isListed() && verdict.getConfidence() >= minConfidence;
        }
        return false;
    }

    public boolean isWhitelisted(String ip) {
        for (CidrBlock block : whitelist) {
            if (block.contains(ip)) {
                return true;
            }
        }
        return false;
    }

    private static List<CidrBlock> parseBlocks(List<String> values) {
        List<CidrBlock> blocks = new ArrayList<>();
        for (String value : values) {
            blocks.add(CidrBlock.parse(value));
        }
        return blocks;
    }
}
