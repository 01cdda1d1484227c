package com.elssolution.ammeterlab.archive;

import org.junit.jupiter.api.BeforeEach;

class InMemoryResultArchiveTest extends ResultArchiveContract {

    private InMemoryResultArchive archive;

    @BeforeEach
    void setUp() {
        archive = new InMemoryResultArchive();
    }

    @Override
    ResultArchive archive() {
        return archive;
    }
}
