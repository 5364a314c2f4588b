package io.annopick.gateway.ipam.service;

import lombok.Data;
import java.util.ArrayList;
import java.util.List;

/**
 * Every distinct address recorded for one machine name.
 */
@Data
public class AddressView {
    private List<String> addrs = new ArrayList<>();
    private String component;
    // false once any address of the machine failed a probe, null until probed
    private Boolean routable;

    void merge(String addr, String component, Boolean routable) {
        if (!addrs.contains(addr)) {
            addrs.add(addr);
        }
        this.component = component;
        if (routable != null) {
            this.routable = this.routable == null ? routable : this.routable && routable;
        }
    }
}
