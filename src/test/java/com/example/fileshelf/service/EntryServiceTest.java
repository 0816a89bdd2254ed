package com.example.fileshelf.service;

import com.example.fileshelf.IntegrationTestSupport;
import com.example.fileshelf.dto.EntryDto;
import com.example.fileshelf.dto.EntryUpdate;
import com.example.fileshelf.dto.TransactionDto;
import com.example.fileshelf.entity.Entry;
import com.example.fileshelf.entity.EntryPermission;
import com.example.fileshelf.entity.EntryStatus;
import com.example.fileshelf.entity.EntryType;
import com.example.fileshelf.entity.TransactionAction;
import com.example.fileshelf.exception.EntryNotFoundException;
import com.example.fileshelf.exception.InvalidParentException;
import com.example.fileshelf.exception.NotAuthorException;
import com.example.fileshelf.exception.ObjectNotFoundException;
import com.example.fileshelf.exception.UserNotFoundException;
import com.example.fileshelf.storage.ObjectStat;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;

import java.util.List;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class EntryServiceTest extends IntegrationTestSupport {

    @Autowired
    private EntryService entryService;

    @Autowired
    private UserService userService;

    private String alice;
    private String bob;

    @BeforeEach
    void createUsers() {
        alice = userService.register("alice", "Alice", "secret").id();
        bob = userService.register("bob", "Bob", "secret").id();
    }

    @Test
    void addFile_startsPendingWithZeroSize() {
        EntryDto entry = entryService.addEntry("a.txt", EntryType.FILE, alice, null);

        assertThat(entry.status()).isEqualTo(EntryStatus.PENDING);
        assertThat(entry.size()).isZero();
        assertThat(entry.parentId()).isEqualTo(Entry.ROOT);
        assertThat(entry.permission()).isEqualTo(EntryPermission.PRIVATE);
        assertThat(transactionRepository.countByEntryIdAndAction(entry.id(), TransactionAction.ADD)).isEqualTo(1);
    }

    @Test
    void addDirectory_isFinalizedRightAway() {
        EntryDto dir = entryService.addEntry("docs", EntryType.DIRECTORY, alice, null);

        assertThat(dir.status()).isEqualTo(EntryStatus.FINALIZED);
    }

    @Test
    void addEntry_rejectsUnknownAuthorAndParent() {
        assertThatThrownBy(() -> entryService.addEntry("a.txt", EntryType.FILE, "nobody", null))
                .isInstanceOf(UserNotFoundException.class);
        assertThatThrownBy(() -> entryService.addEntry("a.txt", EntryType.FILE, alice, "missing-parent"))
                .isInstanceOf(EntryNotFoundException.class);
    }

    @Test
    void finalize_takesSizeFromStoredObject() {
        EntryDto entry = entryService.addEntry("a.txt", EntryType.FILE, alice, null);
        when(objectStorage.statObject(entry.id())).thenReturn(new ObjectStat(entry.id(), 4096L));

        EntryDto finalized = entryService.finalizeEntry(entry.id());

        assertThat(finalized.status()).isEqualTo(EntryStatus.FINALIZED);
        assertThat(finalized.size()).isEqualTo(4096L);
        assertThat(entryService.getEntry(entry.id()).size()).isEqualTo(4096L);
        assertThat(transactionRepository.countByEntryIdAndAction(entry.id(), TransactionAction.FINALIZE)).isEqualTo(1);
    }

    @Test
    void finalize_failsWhenObjectWasNeverUploaded() {
        EntryDto entry = entryService.addEntry("a.txt", EntryType.FILE, alice, null);
        when(objectStorage.statObject(entry.id())).thenThrow(new ObjectNotFoundException(entry.id(), null));

        assertThatThrownBy(() -> entryService.finalizeEntry(entry.id(), alice))
                .isInstanceOf(ObjectNotFoundException.class);

        assertThat(entryRepository.findById(entry.id()).orElseThrow().getStatus()).isEqualTo(EntryStatus.PENDING);
        assertThat(transactionRepository.countByEntryIdAndAction(entry.id(), TransactionAction.FINALIZE)).isZero();
    }

    @Test
    void listEntries_onlyReturnsFinalizedAndLiveEntriesOfOwner() {
        EntryDto dir = entryService.addEntry("docs", EntryType.DIRECTORY, alice, null);
        entryService.addEntry("pending.txt", EntryType.FILE, alice, dir.id());
        EntryDto gone = entryService.addEntry("gone", EntryType.DIRECTORY, alice, null);
        entryService.addEntry("bobs", EntryType.DIRECTORY, bob, null);
        entryService.removeEntry(gone.id(), alice);

        assertThat(entryService.listEntries(alice, false, null)).extracting(EntryDto::id).containsExactly(dir.id());
        assertThat(entryService.listEntries(alice, true, null)).extracting(EntryDto::id)
                .containsExactlyInAnyOrder(dir.id(), gone.id());
        assertThat(entryService.listEntries(alice, false, dir.id())).isEmpty();
    }

    @Test
    void listEntries_withUnknownParentFails() {
        assertThatThrownBy(() -> entryService.listEntries(alice, false, "missing"))
                .isInstanceOf(EntryNotFoundException.class);
    }

    @Test
    void removeEntry_cascadesToWholeSubtreeWithSingleAuditRow() {
        EntryDto root = entryService.addEntry("docs", EntryType.DIRECTORY, alice, null);
        EntryDto sub = entryService.addEntry("sub", EntryType.DIRECTORY, alice, root.id());
        EntryDto leaf = entryService.addEntry("a.txt", EntryType.FILE, alice, sub.id());
        EntryDto sibling = entryService.addEntry("other", EntryType.DIRECTORY, alice, null);

        EntryDto removed = entryService.removeEntry(root.id(), alice);

        assertThat(removed.deleted()).isTrue();
        for (String id : List.of(root.id(), sub.id(), leaf.id())) {
            Entry row = entryRepository.findById(id).orElseThrow();
            assertThat(row.isDeleted()).as("deleted %s", id).isTrue();
            assertThat(row.getDeletedSince()).as("deletedSince %s", id).isEqualTo(clock.instant());
        }
        Entry untouched = entryRepository.findById(sibling.id()).orElseThrow();
        assertThat(untouched.isDeleted()).isFalse();
        assertThat(untouched.getDeletedSince()).isNull();

        assertThat(transactionRepository.countByEntryIdAndAction(root.id(), TransactionAction.REMOVE)).isEqualTo(1);
        assertThat(transactionRepository.countByEntryIdAndAction(sub.id(), TransactionAction.REMOVE)).isZero();
        assertThat(transactionRepository.countByEntryIdAndAction(leaf.id(), TransactionAction.REMOVE)).isZero();
    }

    @Test
    void restoreEntry_withoutActorRecordsAuthor() {
        EntryDto root = entryService.addEntry("docs", EntryType.DIRECTORY, alice, null);
        entryService.removeEntry(root.id(), bob);

        EntryDto restored = entryService.restoreEntry(root.id());

        assertThat(restored.deleted()).isFalse();
        assertThat(transactionRepository.findByEntryIdOrderByCreatedAtAsc(root.id()))
                .filteredOn(t -> t.getAction() == TransactionAction.RESTORE)
                .singleElement()
                .satisfies(t -> assertThat(t.getActorId()).isEqualTo(alice));
    }

    @Test
    void restoreEntry_undoesRemoveAndIsIdempotent() {
        EntryDto root = entryService.addEntry("docs", EntryType.DIRECTORY, alice, null);
        EntryDto leaf = entryService.addEntry("a.txt", EntryType.FILE, alice, root.id());
        entryService.removeEntry(root.id(), alice);

        EntryDto restored = entryService.restoreEntry(root.id(), alice);
        EntryDto again = entryService.restoreEntry(root.id(), alice);

        assertThat(restored.deleted()).isFalse();
        assertThat(restored.deletedSince()).isNull();
        assertThat(again.deleted()).isFalse();
        for (String id : List.of(root.id(), leaf.id())) {
            Entry row = entryRepository.findById(id).orElseThrow();
            assertThat(row.isDeleted()).isFalse();
            assertThat(row.getDeletedSince()).isNull();
        }
        assertThat(transactionRepository.countByEntryIdAndAction(root.id(), TransactionAction.RESTORE)).isEqualTo(1);
    }

    @Test
    void deleteEntry_removesOnlyThatRowAndItsTransactions() {
        EntryDto dir = entryService.addEntry("docs", EntryType.DIRECTORY, alice, null);
        EntryDto child = entryService.addEntry("a.txt", EntryType.FILE, alice, dir.id());
        entryService.updateEntry(dir.id(), new EntryUpdate("renamed", null, null, null), alice);

        entryService.deleteEntry(dir.id(), alice, true);

        assertThat(entryRepository.existsById(dir.id())).isFalse();
        assertThat(transactionRepository.findByEntryIdOrderByCreatedAtAsc(dir.id())).isEmpty();
        assertThat(tombstoneRepository.findByEntryId(dir.id()))
                .singleElement()
                .satisfies(t -> {
                    assertThat(t.getAction()).isEqualTo(TransactionAction.DELETE);
                    assertThat(t.getActorId()).isEqualTo(alice);
                    assertThat(t.isObjectPurged()).isFalse();
                });
        assertThatThrownBy(() -> entryService.getEntry(dir.id())).isInstanceOf(EntryNotFoundException.class);

        EntryDto survivor = entryService.getEntry(child.id());
        assertThat(survivor.parentId()).isEqualTo(dir.id());
        assertThat(transactionRepository.countByEntryIdAndAction(child.id(), TransactionAction.ADD)).isEqualTo(1);
        verify(objectStorage, never()).deleteObject(anyString());
    }

    @Test
    void deleteEntry_purgesStoredObjectOfFile() {
        EntryDto file = entryService.addEntry("a.txt", EntryType.FILE, alice, null);

        entryService.deleteEntry(file.id(), bob, true);

        verify(objectStorage).deleteObject(file.id());
        assertThat(tombstoneRepository.findByEntryId(file.id()))
                .singleElement()
                .satisfies(t -> assertThat(t.isObjectPurged()).isTrue());
    }

    @Test
    void updateEntry_permissionChangeIsReservedToAuthor() {
        EntryDto entry = entryService.addEntry("docs", EntryType.DIRECTORY, alice, null);

        assertThatThrownBy(() -> entryService.updateEntry(entry.id(),
                new EntryUpdate(null, null, EntryPermission.PUBLIC, null), bob))
                .isInstanceOf(NotAuthorException.class);
        assertThat(transactionRepository.countByEntryIdAndAction(entry.id(), TransactionAction.MODIFY)).isZero();

        EntryDto updated = entryService.updateEntry(entry.id(),
                new EntryUpdate(null, null, EntryPermission.INCLUSIVE, Set.of(bob)), alice);

        assertThat(updated.permission()).isEqualTo(EntryPermission.INCLUSIVE);
        assertThat(updated.permissionInclusive()).containsExactly(bob);
    }

    @Test
    void updateEntry_nonAuthorMayEditMemberSetOnly() {
        EntryDto entry = entryService.addEntry("docs", EntryType.DIRECTORY, alice, null);
        entryService.updateEntry(entry.id(), new EntryUpdate(null, null, EntryPermission.PUBLIC, Set.of(bob)), alice);

        EntryDto updated = entryService.updateEntry(entry.id(),
                new EntryUpdate(null, null, null, Set.of(bob, "carol")), bob);

        assertThat(updated.permission()).isEqualTo(EntryPermission.PUBLIC);
        assertThat(updated.permissionInclusive()).containsExactlyInAnyOrder(bob, "carol");
        assertThat(entryService.getEntry(entry.id()).permissionInclusive()).containsExactlyInAnyOrder(bob, "carol");

        EntryDto unchangedMode = entryService.updateEntry(entry.id(),
                new EntryUpdate(null, null, EntryPermission.PUBLIC, Set.of(bob)), bob);
        assertThat(unchangedMode.permissionInclusive()).containsExactly(bob);

        assertThatThrownBy(() -> entryService.updateEntry(entry.id(),
                new EntryUpdate(null, null, EntryPermission.INCLUSIVE, null), bob))
                .isInstanceOf(NotAuthorException.class);
        assertThat(entryService.getEntry(entry.id()).permission()).isEqualTo(EntryPermission.PUBLIC);
    }

    @Test
    void updateEntry_appliesOnlyNonNullFields() {
        EntryDto dir = entryService.addEntry("docs", EntryType.DIRECTORY, alice, null);
        EntryDto file = entryService.addEntry("a.txt", EntryType.FILE, alice, null);

        EntryDto renamed = entryService.updateEntry(file.id(), new EntryUpdate("b.txt", null, null, null), bob);
        EntryDto moved = entryService.updateEntry(file.id(), new EntryUpdate(null, dir.id(), null, null), alice);

        assertThat(renamed.name()).isEqualTo("b.txt");
        assertThat(renamed.parentId()).isEqualTo(Entry.ROOT);
        assertThat(moved.name()).isEqualTo("b.txt");
        assertThat(moved.parentId()).isEqualTo(dir.id());
        assertThat(moved.permission()).isEqualTo(EntryPermission.PRIVATE);
        assertThat(entryService.listTransactions(file.id()))
                .extracting(TransactionDto::action)
                .containsExactlyInAnyOrder(TransactionAction.ADD, TransactionAction.MODIFY, TransactionAction.MODIFY);
    }

    @Test
    void updateEntry_rejectsMovingUnderOwnSubtree() {
        EntryDto a = entryService.addEntry("a", EntryType.DIRECTORY, alice, null);
        EntryDto b = entryService.addEntry("b", EntryType.DIRECTORY, alice, a.id());
        EntryDto c = entryService.addEntry("c", EntryType.DIRECTORY, alice, b.id());

        assertThatThrownBy(() -> entryService.updateEntry(a.id(), new EntryUpdate(null, c.id(), null, null), alice))
                .isInstanceOf(InvalidParentException.class);
        assertThatThrownBy(() -> entryService.updateEntry(a.id(), new EntryUpdate(null, a.id(), null, null), alice))
                .isInstanceOf(InvalidParentException.class);
        assertThat(entryService.getEntry(a.id()).parentId()).isEqualTo(Entry.ROOT);

        EntryDto moved = entryService.updateEntry(c.id(), new EntryUpdate(null, Entry.ROOT, null, null), alice);
        assertThat(moved.parentId()).isEqualTo(Entry.ROOT);
    }

    @Test
    void closureOf_collectsAllDescendants() {
        EntryDto a = entryService.addEntry("a", EntryType.DIRECTORY, alice, null);
        EntryDto b = entryService.addEntry("b", EntryType.DIRECTORY, alice, a.id());
        EntryDto c = entryService.addEntry("c.txt", EntryType.FILE, alice, b.id());
        EntryDto d = entryService.addEntry("d.txt", EntryType.FILE, bob, a.id());

        assertThat(entryService.closureOf(a.id())).containsExactlyInAnyOrder(a.id(), b.id(), c.id(), d.id());
        assertThat(entryService.closureOf(c.id())).containsExactly(c.id());
    }

    @Test
    void readsAfterMutationsSeeNewState() {
        EntryDto dir = entryService.addEntry("docs", EntryType.DIRECTORY, alice, null);
        EntryDto file = entryService.addEntry("a.txt", EntryType.FILE, alice, dir.id());

        // warm every cached view
        assertThat(entryService.getEntry(dir.id()).name()).isEqualTo("docs");
        assertThat(entryService.listEntries(alice, false, null)).hasSize(1);
        assertThat(entryService.listEntries(alice, true, dir.id())).isEmpty();

        when(objectStorage.statObject(file.id())).thenReturn(new ObjectStat(file.id(), 12L));
        entryService.finalizeEntry(file.id(), alice);
        assertThat(entryService.listEntries(alice, false, null)).hasSize(2);
        assertThat(entryService.listEntries(alice, true, dir.id())).extracting(EntryDto::id).containsExactly(file.id());

        entryService.updateEntry(dir.id(), new EntryUpdate("renamed", null, null, null), alice);
        assertThat(entryService.getEntry(dir.id()).name()).isEqualTo("renamed");

        entryService.removeEntry(dir.id(), alice);
        assertThat(entryService.getEntry(file.id()).deleted()).isTrue();
        assertThat(entryService.listEntries(alice, false, null)).isEmpty();
        assertThat(entryService.listEntries(alice, true, dir.id())).extracting(EntryDto::deleted).containsExactly(true);

        entryService.restoreEntry(dir.id(), alice);
        assertThat(entryService.getEntry(file.id()).deleted()).isFalse();
        assertThat(entryService.listEntries(alice, false, null)).hasSize(2);
    }

    @Test
    void failedMutationLeavesCacheUntouched() {
        EntryDto entry = entryService.addEntry("docs", EntryType.DIRECTORY, alice, null);
        EntryDto cached = entryService.getEntry(entry.id());

        assertThatThrownBy(() -> entryService.updateEntry(entry.id(),
                new EntryUpdate("hijacked", null, EntryPermission.PUBLIC, null), bob))
                .isInstanceOf(NotAuthorException.class);

        assertThat(entryService.getEntry(entry.id())).isEqualTo(cached);
        assertThat(entryRepository.findById(entry.id()).orElseThrow().getName()).isEqualTo("docs");
    }
}
