package dev.pekelund.reconcile.processor.extraction;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.ObjectMapper;
import dev.pekelund.reconcile.lines.CandidateLine;
import dev.pekelund.reconcile.lines.RawValueParser;
import java.io.IOException;
import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.format.DateTimeParseException;
import java.util.List;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.ai.chat.messages.SystemMessage;
import org.springframework.ai.chat.messages.UserMessage;
import org.springframework.ai.chat.model.ChatModel;
import org.springframework.ai.chat.model.ChatResponse;
import org.springframework.ai.chat.prompt.ChatOptions;
import org.springframework.ai.chat.prompt.Prompt;
import org.springframework.ai.content.Media;
import org.springframework.http.MediaType;
import org.springframework.http.MediaTypeFactory;
import org.springframework.util.MimeType;
import org.springframework.util.StringUtils;

/**
 * {@link InvoiceLineExtractor} that attaches the document to a Spring AI {@link ChatModel} prompt and
 * reads the line table from the JSON it answers with. Cell values are kept as text so that the raw values
 * stored on each line are exactly what the model read.
 */
public class ChatModelInvoiceExtractor implements InvoiceLineExtractor {

    private static final Logger LOGGER = LoggerFactory.getLogger(ChatModelInvoiceExtractor.class);

    private static final String FORMAT_INSTRUCTIONS = """
        Return a JSON object with the following structure:
        {
          "vendor": {
            "name": string|null,
            "address": string|null,
            "phone": string|null
          },
          "invoiceNumber": string|null,
          "invoiceDate": string|null (ISO-8601 date),
          "total": number|null,
          "lines": [
            {
              "description": string|null,
              "quantity": string|null,
              "unitPrice": string|null,
              "total": string|null,
              "unit": string|null,
              "sku": string|null,
              "weight": string|null,
              "format": string|null,
              "columns": [string]
            }
          ]
        }
        Copy every line value exactly as printed, including units, currency symbols and decimal commas.
        "columns" lists the cells of the row from left to right.
        Use null for unknown values. Do not add code fences or commentary; return only the JSON document.
        """;

    private final ChatModel chatModel;
    private final ObjectMapper objectMapper;
    private final ChatOptions chatOptions;

    public ChatModelInvoiceExtractor(ChatModel chatModel, ObjectMapper objectMapper, ChatOptions chatOptions) {
        this.chatModel = Objects.requireNonNull(chatModel, "chatModel");
        this.objectMapper = Objects.requireNonNull(objectMapper, "objectMapper");
        this.chatOptions = chatOptions;
    }

    @Override
    public ExtractedInvoice extract(byte[] document, String fileName, String promptHints) {
        if (document == null || document.length == 0) {
            throw new InvoiceExtractionException("Cannot extract invoice lines from an empty document");
        }

        MimeType mimeType = documentType(fileName);
        String instructions = buildInstructions(promptHints);
        Prompt prompt = new Prompt(List.of(
            new SystemMessage(instructions),
            UserMessage.builder()
                .text(buildRequestText(fileName))
                .media(Media.builder().mimeType(mimeType).data(document).build())
                .build()),
            chatOptions);
        LOGGER.info("Extracting invoice '{}' ({}, {} bytes) with model '{}' (hints: {})", fileName, mimeType,
            document.length, chatOptions != null ? chatOptions.getModel() : null, StringUtils.hasText(promptHints));

        ChatResponse chatResponse = chatModel.call(prompt);
        String response = chatResponse != null && chatResponse.getResult() != null
            && chatResponse.getResult().getOutput() != null
            ? chatResponse.getResult().getOutput().getText()
            : null;
        if (!StringUtils.hasText(response)) {
            throw new InvoiceExtractionException("Extraction model returned an empty response");
        }
        LOGGER.debug("Extraction model raw response: {}", response);

        InvoiceOutput output = parseStructuredResponse(sanitiseResponse(response));
        List<CandidateLine> lines = output.lines() != null
            ? output.lines().stream().filter(Objects::nonNull).map(LineOutput::toCandidate).toList()
            : List.of();
        VendorOutput vendor = output.vendor();
        ExtractedInvoice.VendorInfo vendorInfo = vendor != null
            ? new ExtractedInvoice.VendorInfo(vendor.name(), vendor.address(), vendor.phone())
            : null;
        LOGGER.info("Extracted {} candidate lines from '{}'", lines.size(), fileName);
        return new ExtractedInvoice(vendorInfo, output.invoiceNumber(), parseDate(output.invoiceDate()),
            RawValueParser.parseDecimal(output.total()), lines, response);
    }

    String buildInstructions(String promptHints) {
        StringBuilder instructions = new StringBuilder();
        instructions.append("You are an expert system that extracts line items from vendor invoices.\n");
        instructions.append("The invoice document is attached to the request.\n");
        if (StringUtils.hasText(promptHints)) {
            instructions.append("This vendor's invoices have a known layout:\n");
            instructions.append(promptHints.trim()).append('\n');
        }
        instructions.append(FORMAT_INSTRUCTIONS);
        return instructions.toString();
    }

    static String buildRequestText(String fileName) {
        return "File name: " + (fileName != null ? fileName : "invoice.pdf") + "\nExtract the invoice lines.";
    }

    static MimeType documentType(String fileName) {
        if (!StringUtils.hasText(fileName)) {
            return MediaType.APPLICATION_PDF;
        }
        return MediaTypeFactory.getMediaType(fileName)
            .filter(type -> type.equals(MediaType.APPLICATION_PDF) || "image".equals(type.getType()))
            .map(MimeType.class::cast)
            .orElse(MediaType.APPLICATION_PDF);
    }

    static String sanitiseResponse(String response) {
        String trimmed = response.trim();
        if (trimmed.startsWith("```") && trimmed.endsWith("```") && trimmed.length() >= 6) {
            int firstBreak = trimmed.indexOf('\n');
            if (firstBreak > 0) {
                trimmed = trimmed.substring(firstBreak + 1, trimmed.length() - 3).trim();
            } else {
                trimmed = trimmed.substring(3, trimmed.length() - 3).trim();
            }
        }
        if (trimmed.startsWith("`") && trimmed.endsWith("`") && trimmed.length() >= 2) {
            trimmed = trimmed.substring(1, trimmed.length() - 1).trim();
        }
        return trimmed;
    }

    private InvoiceOutput parseStructuredResponse(String response) {
        try {
            InvoiceOutput output = objectMapper.readValue(response, InvoiceOutput.class);
            if (output == null) {
                throw new InvoiceExtractionException("Extraction model returned an empty document");
            }
            return output;
        } catch (IOException ex) {
            LOGGER.error("Failed to parse extraction response. Payload begins with: {}", preview(response));
            throw new InvoiceExtractionException(
                "Extraction model returned a response that could not be parsed into invoice lines", ex);
        }
    }

    private static LocalDate parseDate(String value) {
        if (!StringUtils.hasText(value)) {
            return null;
        }
        try {
            return LocalDate.parse(value.trim());
        } catch (DateTimeParseException ex) {
            LOGGER.warn("Ignoring invoice date '{}' that is not an ISO-8601 date", value);
            return null;
        }
    }

    private static String preview(String response) {
        int max = Math.min(response.length(), 256);
        return response.substring(0, max);
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    record InvoiceOutput(VendorOutput vendor, String invoiceNumber, String invoiceDate, String total,
        List<LineOutput> lines) {
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    record VendorOutput(String name, String address, String phone) {
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    record LineOutput(String description, String quantity, String unitPrice, String total, String unit, String sku,
        String weight, String format, List<String> columns) {

        CandidateLine toCandidate() {
            return new CandidateLine(description, quantity, unitPrice, total, unit, sku, weight, format, columns);
        }
    }
}
