package com.eainde.nlg.data;

import com.eainde.nlg.model.Message;

import java.util.List;

/**
 * Messages about the selected location ({@code core}) and about every other location ({@code expanded}).
 */
public record ExtractedMessages(List<Message> core, List<Message> expanded) {
}
