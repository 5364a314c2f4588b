package io.annopick.gateway.ipam.firewall;

import lombok.Value;

@Value
public class MappedRules {
    String forwardRuleId;
    String preroutingRuleId;
}
