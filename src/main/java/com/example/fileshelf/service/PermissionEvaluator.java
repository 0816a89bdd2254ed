package com.example.fileshelf.service;

import com.example.fileshelf.dto.EntryDto;
import org.springframework.stereotype.Component;

/**
 * View/modify decisions keyed by an entry's permission mode.
 * <p>
 * <pre>
 * permission          view          modify
 * PRIVATE             no            no
 * PUBLIC              yes           member
 * PUBLIC_READONLY     yes           no
 * INCLUSIVE           member        member
 * INCLUSIVE_READONLY  member        no
 * OTHER               no            no
 * </pre>
 * "member" means the user id is in {@code permissionInclusive}. The table does not know
 * about authorship; callers decide whether the author bypasses it. Changing the
 * permission itself is gated in {@link EntryService#updateEntry}.
 */
@Component
public class PermissionEvaluator {

    public boolean canView(EntryDto entry, String userId) {
        return switch (entry.permission()) {
            case PUBLIC, PUBLIC_READONLY -> true;
            case INCLUSIVE, INCLUSIVE_READONLY -> isMember(entry, userId);
            case PRIVATE, OTHER -> false;
        };
    }

    public boolean canModify(EntryDto entry, String userId) {
        return switch (entry.permission()) {
            case PUBLIC, INCLUSIVE -> isMember(entry, userId);
            case PUBLIC_READONLY, INCLUSIVE_READONLY, PRIVATE, OTHER -> false;
        };
    }

    private static boolean isMember(EntryDto entry, String userId) {
        return userId != null && entry.permissionInclusive().contains(userId);
    }
}
