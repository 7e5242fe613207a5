package com.bsm.hypergraph.community;

/**
 * Size and majority labels of one community.
 */
public record CommunitySummary(
        int id,
        int size,

        /** Most frequent CMDB class among the members */
        String dominantClass,

        /** Business service named most often by the members' changes */
        String dominantService) {
}
