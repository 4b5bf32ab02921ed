package com.questrail.soapd.wsdl;

import java.util.List;
import java.util.Objects;

/**
 * Summary of one {@link WsdlImporter#importFrom} call.
 *
 * @param implemented        operations answered by an explicit or default callback
 * @param stubbed            operations registered without any callback
 * @param unmatchedCallbacks callback names that matched no operation, sorted
 */
public record ImportReport(
        String location,
        List<String> implemented,
        List<String> stubbed,
        List<String> unmatchedCallbacks
) {
    public ImportReport {
        Objects.requireNonNull(location, "location");
        implemented = List.copyOf(implemented);
        stubbed = List.copyOf(stubbed);
        unmatchedCallbacks = List.copyOf(unmatchedCallbacks);
    }

    public int operationCount() {
        return implemented.size() + stubbed.size();
    }
}
