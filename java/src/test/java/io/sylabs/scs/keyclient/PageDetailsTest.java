package io.sylabs.scs.keyclient;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class PageDetailsTest {

    @Test
    void firstPageHasNoToken() {
        PageDetails page = PageDetails.first(50);

        assertEquals(50, page.size());
        assertEquals("", page.token());
        assertFalse(page.hasToken());
    }

    @Test
    void carriesTokenUnchanged() {
        PageDetails next = PageDetails.first(50).withToken("opaque-token==");

        assertEquals(50, next.size());
        assertEquals("opaque-token==", next.token());
        assertTrue(next.hasToken());
    }

    @Test
    void nullTokenIsEmpty() {
        assertEquals(new PageDetails(10, ""), new PageDetails(10, null));
    }
}
