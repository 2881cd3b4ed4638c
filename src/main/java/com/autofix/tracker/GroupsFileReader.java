package com.autofix.tracker;

import com.autofix.core.model.IssueGroup;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

/**
 * Reads pre-grouped issues from a JSON array of groups, bypassing the tracker fetch.
 * Unset unions and priority are derived from the issues; a missing branch becomes
 * {@code fix/<id>}.
 */
public class GroupsFileReader {

    private final ObjectMapper objectMapper;

    public GroupsFileReader(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper.copy().configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, true);
    }

    public List<IssueGroup> read(Path file) {
        List<IssueGroup> raw;
        try {
            raw = objectMapper.readValue(Files.readString(file), new TypeReference<List<IssueGroup>>() {});
        } catch (IOException e) {
            throw new IssueTrackerException("Cannot read groups file " + file + ": " + e.getMessage(), e);
        }
        return raw.stream().map(GroupsFileReader::normalize).toList();
    }

    private static IssueGroup normalize(IssueGroup group) {
        if (group.id() == null || group.id().isBlank()) {
            throw new IssueTrackerException("Group without id in groups file");
        }
        String branch = group.branchName() == null || group.branchName().isBlank()
                ? "fix/" + group.id()
                : group.branchName();
        String name = group.name() == null ? group.id() : group.name();
        IssueGroup derived = IssueGroup.of(group.id(), name, branch, group.issues());
        return new IssueGroup(derived.id(), derived.name(), derived.issues(), derived.branchName(),
                group.relatedFiles().isEmpty() ? derived.relatedFiles() : group.relatedFiles(),
                group.components().isEmpty() ? derived.components() : group.components(),
                derived.priority());
    }
}
