package net.scoreworks.liveobjects;

import net.scoreworks.liveobjects.entries.DataEntry;
import net.scoreworks.test_model.Note;
import net.scoreworks.test_model.Track;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

public class ScopeTests {
    LiveObjectRegistry registry;
    Track track;
    Note note, otherNote;

    @BeforeEach
    public void prepareRegistry() {
        registry = new LiveObjectRegistry();
        track = new Track("violin");
        note = new Note(track, 60);
        otherNote = new Note(track, 62);
    }

    @AfterEach
    public void cleanUp() {
        registry.clear();
    }

    @Test
    public void testNewScopeBecomesCurrent() {
        Assertions.assertNull(registry.getCurrentScope());
        Scope outer = registry.newScope();
        Assertions.assertSame(outer, registry.getCurrentScope());
        Assertions.assertNull(outer.getParent());

        Scope inner = registry.newScope();
        Assertions.assertSame(inner, registry.getCurrentScope());
        Assertions.assertSame(outer, inner.getParent());
        Assertions.assertSame(registry, inner.getRegistry());
        Assertions.assertEquals(2, registry.getOpenScopeCount());
    }

    @Test
    public void testObjectsArePushedIntoCurrentScope() {
        Scope outer = registry.newScope();
        registry.insert("A", note);
        Scope inner = registry.newScope();
        registry.insert("B", otherNote);
        Assertions.assertEquals(1, outer.size());
        Assertions.assertSame(note, outer.getItems().get(0));
        Assertions.assertEquals(1, inner.size());
        Assertions.assertSame(otherNote, inner.getItems().get(0));
        Assertions.assertThrows(UnsupportedOperationException.class, () -> inner.getItems().clear());
    }

    @Test
    public void testRemovingScopeRestoresParent() {
        Scope outer = registry.newScope();
        Scope inner = registry.newScope();
        inner.remove();
        Assertions.assertTrue(inner.isRemoved());
        Assertions.assertSame(outer, registry.getCurrentScope());
        Assertions.assertEquals(1, registry.getOpenScopeCount());
        outer.remove();
        Assertions.assertNull(registry.getCurrentScope());
        Assertions.assertEquals(0, registry.getOpenScopeCount());
    }

    @Test
    public void testDetachKeepsScopeOpen() {
        Scope outer = registry.newScope();
        Scope inner = registry.newScope();
        registry.insert("A", note);
        inner.detach();
        Assertions.assertSame(outer, registry.getCurrentScope());
        Assertions.assertEquals(2, registry.getOpenScopeCount());
        Assertions.assertSame(note, registry.idToObject("A"));
        //detaching a scope that is not current changes nothing
        registry.detachScope(inner);
        Assertions.assertSame(outer, registry.getCurrentScope());
    }

    @Test
    public void testCurrentScopeSkipsRemovedAncestors() {
        Scope outer = registry.newScope();
        Scope middle = registry.newScope();
        Scope inner = registry.newScope();
        middle.remove();
        Assertions.assertSame(inner, registry.getCurrentScope());
        inner.remove();
        Assertions.assertSame(outer, registry.getCurrentScope());
    }

    @Test
    public void testRemovingScopeErasesItsObjects() {
        Scope scope = registry.newScope();
        DataEntry entry = new DataEntry("A", null);
        registry.insert(entry, note);
        scope.remove();
        Assertions.assertNull(registry.idToObject("A"));
        Assertions.assertNull(registry.objectToId(note));
        Assertions.assertNull(registry.idToEntry("A"));
        Assertions.assertTrue(scope.isEmpty());
    }

    @Test
    public void testDroppedObjectIsGoneOnceScopeIsRemoved() {
        Scope scope = registry.newScope();
        registry.insert("A", new Note(null, 30));
        Assertions.assertNotNull(registry.idToObject("A"));
        scope.remove();
        Assertions.assertNull(registry.idToObject("A"));
    }

    @Test
    public void testObjectsOfOuterScopeSurviveInnerScope() {
        Scope outer = registry.newScope();
        registry.insert("A", note);
        try (Scope inner = registry.newScope()) {
            registry.insert("B", otherNote);
            Assertions.assertSame(inner, registry.getCurrentScope());
        }
        Assertions.assertSame(outer, registry.getCurrentScope());
        Assertions.assertSame(note, registry.idToObject("A"));
        Assertions.assertNull(registry.idToObject("B"));
    }

    @Test
    public void testObjectHeldByAnotherScopeIsNotErased() {
        Scope outer = registry.newScope();
        Scope inner = registry.newScope();
        registry.insert("A", note);
        outer.push(note);
        inner.remove();
        Assertions.assertSame(note, registry.idToObject("A"));
        outer.remove();
        Assertions.assertNull(registry.idToObject("A"));
    }

    @Test
    public void testImmortalObjectOutlivesScope() {
        Scope scope = registry.newScope();
        registry.registerObject("A", note, RegistrationOptions.immortal());
        scope.remove();
        Assertions.assertSame(note, registry.idToObject("A"));
    }

    @Test
    public void testClearedScopeReleasesWithoutErasing() {
        Scope scope = registry.newScope();
        registry.insert("A", note);
        scope.clear();
        Assertions.assertTrue(scope.isEmpty());
        Assertions.assertSame(scope, registry.getCurrentScope());
        //still mapped while something else holds the object
        Assertions.assertSame(note, registry.idToObject("A"));
    }

    @Test
    public void testReclaimedScopeIsTornDown() {
        Scope outer = registry.newScope();
        Scope abandoned = registry.newScope();
        registry.insert("A", note);
        //simulate the collector reclaiming a scope nobody removed
        abandoned.handle.clear();
        abandoned.handle.enqueue();

        Assertions.assertEquals(1, registry.getOpenScopeCount());
        Assertions.assertSame(outer, registry.getCurrentScope());
        Assertions.assertNull(registry.idToObject("A"));
    }

    @Test
    public void testRemovingScopeTwiceIsHarmless() {
        Scope outer = registry.newScope();
        Scope inner = registry.newScope();
        inner.remove();
        inner.remove();
        Assertions.assertSame(outer, registry.getCurrentScope());
        Assertions.assertEquals(1, registry.getOpenScopeCount());
    }
}
