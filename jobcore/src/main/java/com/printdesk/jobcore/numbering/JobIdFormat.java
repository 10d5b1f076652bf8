package com.printdesk.jobcore.numbering;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * String formats of job and change-order identifiers.
 *
 * <pre>
 *   baseJobId      {jobTypeCode}{separator}{masterSeq zero-padded to width}   BK000001, ME2000017
 *   changeOrderNo  {baseJobId}-CO{version}                                    BK000001-CO2
 * </pre>
 *
 * Separator and width come from configuration. With an empty separator the
 * digits of a type code such as ME2 run into the sequence, and once masterSeq
 * outgrows the width the split is ambiguous: BK1234567 may be BK + 1234567 or
 * BK1 + 234567. {@link #parseBaseJobId} gives the type code as many digits as
 * it can while the sequence stays positive. Lookups never depend on that
 * split; {@link #parseChangeOrderNo} only checks the shape of the base id.
 */
@Component
public class JobIdFormat {

    public record ParsedBaseJobId(String jobTypeCode, long masterSeq) {}

    public record ParsedChangeOrderNo(String baseJobId, int version) {}

    static final Pattern TYPE_CODE = Pattern.compile("[A-Z]+\\d*");

    private static final Pattern CHANGE_ORDER_NO = Pattern.compile("^(.+)-CO([1-9]\\d*)$");

    private final String  separator;
    private final int     width;
    private final Pattern baseJobIdPattern;
    private final Pattern baseJobIdShape;

    public JobIdFormat(
            @Value("${printdesk.job-id.separator:}") String separator,
            @Value("${printdesk.job-id.seq-width:6}") int width) {
        if (width < 1 || width > 18) {
            throw new IllegalArgumentException("printdesk.job-id.seq-width must be 1..18, got " + width);
        }
        this.separator = separator == null ? "" : separator;
        this.width     = width;
        this.baseJobIdPattern = Pattern.compile(
                "^([A-Z]+\\d*)" + Pattern.quote(this.separator) + "(\\d{" + width + ",})$");
        this.baseJobIdShape = Pattern.compile(
                "^[A-Z]+\\d*" + Pattern.quote(this.separator) + "\\d{" + width + ",}$");
    }

    public static boolean isValidTypeCode(String code) {
        return code != null && TYPE_CODE.matcher(code).matches();
    }

    public String baseJobId(String jobTypeCode, long masterSeq) {
        if (!isValidTypeCode(jobTypeCode)) {
            throw new IllegalArgumentException("Invalid job type code: '" + jobTypeCode + "'");
        }
        if (masterSeq < 1) {
            throw new IllegalArgumentException("masterSeq must be positive, got " + masterSeq);
        }
        String digits = Long.toString(masterSeq);
        StringBuilder sb = new StringBuilder(jobTypeCode).append(separator);
        for (int i = digits.length(); i < width; i++) sb.append('0');
        return sb.append(digits).toString();
    }

    public Optional<ParsedBaseJobId> parseBaseJobId(String baseJobId) {
        if (baseJobId == null) return Optional.empty();
        Matcher m = baseJobIdPattern.matcher(baseJobId);
        if (!m.matches()) return Optional.empty();
        String code   = m.group(1);
        String digits = m.group(2);
        try {
            long seq = Long.parseLong(digits);
            // BK1000000: the greedy split leaves BK1 + 000000, so hand digits back
            while (seq == 0 && separator.isEmpty() && Character.isDigit(code.charAt(code.length() - 1))) {
                digits = code.charAt(code.length() - 1) + digits;
                code   = code.substring(0, code.length() - 1);
                seq    = Long.parseLong(digits);
            }
            return seq < 1 ? Optional.empty() : Optional.of(new ParsedBaseJobId(code, seq));
        } catch (NumberFormatException e) {
            return Optional.empty();   // more digits than a long holds
        }
    }

    public static String changeOrderNo(String baseJobId, int version) {
        return baseJobId + "-CO" + version;
    }

    public Optional<ParsedChangeOrderNo> parseChangeOrderNo(String changeOrderNo) {
        if (changeOrderNo == null) return Optional.empty();
        Matcher m = CHANGE_ORDER_NO.matcher(changeOrderNo);
        if (!m.matches() || !baseJobIdShape.matcher(m.group(1)).matches()) return Optional.empty();
        try {
            return Optional.of(new ParsedChangeOrderNo(m.group(1), Integer.parseInt(m.group(2))));
        } catch (NumberFormatException e) {
            return Optional.empty();
        }
    }
}
