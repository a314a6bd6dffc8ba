package com.linechat.chat.server;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class ChatMessageTest {

    @Test
    void knownKeywordsAreCommands() {
        assertEquals(new ChatMessage.Command(CommandName.HELP, ""), ChatMessage.parse("/help"));
        assertEquals(new ChatMessage.Command(CommandName.LIST, ""), ChatMessage.parse("/list"));
        assertEquals(new ChatMessage.Command(CommandName.STATS, ""), ChatMessage.parse("/stats"));
        assertEquals(new ChatMessage.Command(CommandName.PRIVATE, "bob hi there"),
                ChatMessage.parse("/private bob hi there"));
    }

    @Test
    void argumentsAreKeptVerbatim() {
        ChatMessage.Command command = (ChatMessage.Command) ChatMessage.parse("/private  bob  spaced ");
        assertEquals(" bob  spaced ", command.getArgs());
    }

    @Test
    void unknownKeywordsArePlainText() {
        assertEquals(new ChatMessage.PlainText("/quit"), ChatMessage.parse("/quit"));
        assertEquals(new ChatMessage.PlainText("/"), ChatMessage.parse("/"));
        assertEquals(new ChatMessage.PlainText("/HELP"), ChatMessage.parse("/HELP"));
        assertEquals(new ChatMessage.PlainText("/he"), ChatMessage.parse("/he"));
    }

    @Test
    void keywordIsMatchedAsPrefix() {
        assertEquals(new ChatMessage.Command(CommandName.HELP, ""), ChatMessage.parse("/helpme"));
        assertEquals(new ChatMessage.Command(CommandName.LIST, ""), ChatMessage.parse("/listall"));
        assertEquals(new ChatMessage.Command(CommandName.STATS, ""), ChatMessage.parse("/stats!"));
        assertEquals(new ChatMessage.Command(CommandName.LIST, "please"), ChatMessage.parse("/listing please"));
    }

    @Test
    void argumentsStartAfterFirstSpaceOfPayload() {
        // a tab does not separate the keyword, so the user name is swallowed into the keyword part
        assertEquals(new ChatMessage.Command(CommandName.PRIVATE, "hi"), ChatMessage.parse("/private\tbob hi"));
        assertEquals(new ChatMessage.Command(CommandName.PRIVATE, "x y"), ChatMessage.parse("/privatebob x y"));
    }

    @Test
    void ordinaryTextIsPlainText() {
        assertEquals(new ChatMessage.PlainText("hello /help"), ChatMessage.parse("hello /help"));
        assertEquals(new ChatMessage.PlainText(" /list"), ChatMessage.parse(" /list"));
    }

    @Test
    void noticesRenderWithServerPrefix() {
        assertEquals("[SERVER] bob has joined the chat.", ChatMessage.SystemNotice.joined("bob").render());
        assertEquals("[SERVER] bob has left the chat.", ChatMessage.SystemNotice.left("bob").render());
    }
}
