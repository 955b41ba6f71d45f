/*
 * Copyright 2014 Ran Meng
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *         http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package com.github.totyumengr.olapcubes.core;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.time.temporal.IsoFields;
import java.util.Date;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Derive coarser temporal members from a raw date or date-time value. Members are ISO-like strings so that they 
 * sort naturally: <code>2025</code>, <code>2025-Q1</code>, <code>2025-01</code>, <code>2025-W01</code>, 
 * <code>2025-01-01</code>, <code>2025-01-01T08</code>.
 * 
 * @author mengran
 *
 */
final class TemporalLevels {
    
    private static final Pattern TEMPORAL_TEXT = 
            Pattern.compile("\\d{4}-\\d{2}-\\d{2}([ T]\\d{2}:\\d{2}(:\\d{2}(\\.\\d{1,9})?)?)?");
    
    private static final DateTimeFormatter SECONDS = DateTimeFormatter.ofPattern("uuuu-MM-dd HH:mm:ss", Locale.ROOT);
    
    private TemporalLevels() {
    }
    
    /**
     * Canonical text of a date or date-time, so that a JDBC {@link java.sql.Timestamp}, a {@link LocalDateTime} and 
     * the strings <code>2025-01-06 08:00:00</code> or <code>2025-01-06T08:00</code> are the same member.
     * 
     * @param value raw value
     * @return <code>2025-01-06</code> for dates, <code>2025-01-06 08:00:00</code> for date-times, 
     *      <code>null</code> if value is not temporal
     */
    static String canonical(Object value) {
        
        if (value instanceof java.sql.Date || value instanceof LocalDate) {
            return parse(value).toLocalDate().toString();
        }
        if (value instanceof java.sql.Time) {
            return null;
        }
        if (value instanceof Date || value instanceof LocalDateTime) {
            return format(parse(value));
        }
        if (value instanceof String && TEMPORAL_TEXT.matcher((String) value).matches()) {
            String text = (String) value;
            try {
                LocalDateTime time = parse(text);
                return text.length() == 10 ? time.toLocalDate().toString() : format(time);
            } catch (AggregationException e) {
                // Looks like a date but is not one, e.g. 2025-13-45
                return null;
            }
        }
        return null;
    }
    
    private static String format(LocalDateTime time) {
        return time.getNano() == 0 ? SECONDS.format(time) : time.toString().replace('T', ' ');
    }
    
    /**
     * @param raw {@link LocalDate}, {@link LocalDateTime}, {@link Date} or their ISO string forms
     * @param level one of <code>year, quarter, month, week, day, hour</code>, anything else keeps raw value
     * @return member of level
     * @throws AggregationException when raw value is not a date
     */
    static Object truncate(Object raw, String level) {
        
        if (raw == null) {
            return null;
        }
        String l = level.toLowerCase(Locale.ROOT);
        switch (l) {
            case "year":
            case "quarter":
            case "month":
            case "week":
            case "day":
            case "hour":
                break;
            default:
                return raw;
        }
        
        LocalDateTime time = parse(raw);
        switch (l) {
            case "year":
                return String.valueOf(time.getYear());
            case "quarter":
                return time.getYear() + "-Q" + time.get(IsoFields.QUARTER_OF_YEAR);
            case "month":
                return String.format(Locale.ROOT, "%04d-%02d", time.getYear(), time.getMonthValue());
            case "week":
                return String.format(Locale.ROOT, "%04d-W%02d", time.get(IsoFields.WEEK_BASED_YEAR), 
                    time.get(IsoFields.WEEK_OF_WEEK_BASED_YEAR));
            case "day":
                return time.toLocalDate().toString();
            default:
                return String.format(Locale.ROOT, "%sT%02d", time.toLocalDate(), time.getHour());
        }
    }
    
    private static LocalDateTime parse(Object raw) {
        
        if (raw instanceof LocalDateTime) {
            return (LocalDateTime) raw;
        }
        if (raw instanceof LocalDate) {
            return ((LocalDate) raw).atStartOfDay();
        }
        if (raw instanceof java.sql.Date) {
            return ((java.sql.Date) raw).toLocalDate().atStartOfDay();
        }
        if (raw instanceof java.sql.Timestamp) {
            return ((java.sql.Timestamp) raw).toLocalDateTime();
        }
        if (raw instanceof Date) {
            return LocalDateTime.ofInstant(((Date) raw).toInstant(), ZoneId.systemDefault());
        }
        String text = raw.toString().trim();
        try {
            if (text.length() > 10) {
                return LocalDateTime.parse(text.replace(' ', 'T'));
            }
            return LocalDate.parse(text).atStartOfDay();
        } catch (DateTimeParseException e) {
            throw new AggregationException("Can not parse temporal value '" + raw + "'", e);
        }
    }
}
