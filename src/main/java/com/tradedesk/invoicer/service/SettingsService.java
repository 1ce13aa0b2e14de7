package com.tradedesk.invoicer.service;

import com.tradedesk.invoicer.dto.SellerDetails;
import com.tradedesk.invoicer.dto.SettingsRequest;
import com.tradedesk.invoicer.dto.SettingsResponse;
import com.tradedesk.invoicer.exception.ValidationException;
import com.tradedesk.invoicer.exception.ValidationFailure;
import com.tradedesk.invoicer.model.InvoicingSetting;
import com.tradedesk.invoicer.repository.InvoicingSettingRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Runtime settings stored in {@code invoicing_settings}, falling back to the
 * {@code invoicing.*} properties when a key is absent.
 * <p>
 * GST rates are percentages between 0 and 100 with at most two decimal places,
 * the precision an invoice stores its rate with.
 */
@Service
public class SettingsService {

    private static final Logger logger = LoggerFactory.getLogger(SettingsService.class);

    private static final BigDecimal MAX_GST_RATE = new BigDecimal("100");
    private static final int GST_RATE_SCALE = 2;

    public static final String KEY_COMPANY_NAME = "company_name";
    public static final String KEY_COMPANY_PHONE = "company_phone";
    public static final String KEY_COMPANY_ADDRESS = "company_address";
    public static final String KEY_GST_RATE = "gst_rate";

    private final InvoicingSettingRepository settingRepository;
    private final BigDecimal defaultGstRate;
    private final String currencySymbol;
    private final String numberPrefix;

    public SettingsService(InvoicingSettingRepository settingRepository,
            @Value("${invoicing.gst-rate:18}") BigDecimal defaultGstRate,
            @Value("${invoicing.currency-symbol:₹}") String currencySymbol,
            @Value("${invoicing.number-prefix:INV-}") String numberPrefix) {
        this.settingRepository = settingRepository;
        this.defaultGstRate = requireValidRate(defaultGstRate);
        this.currencySymbol = currencySymbol;
        this.numberPrefix = numberPrefix;
    }

    /**
     * Total GST percentage, split evenly into CGST and SGST on every invoice.
     */
    @Transactional(readOnly = true)
    public BigDecimal getGstRate() {
        return value(KEY_GST_RATE)
                .map(val -> {
                    try {
                        BigDecimal rate = new BigDecimal(val.trim());
                        if (!isValidRate(rate)) {
                            logger.warn("Ignoring out of range gst_rate setting '{}', using {}", val, defaultGstRate);
                            return defaultGstRate;
                        }
                        return rate;
                    } catch (NumberFormatException e) {
                        logger.warn("Ignoring malformed gst_rate setting '{}', using {}", val, defaultGstRate);
                        return defaultGstRate;
                    }
                })
                .orElse(defaultGstRate);
    }

    @Transactional(readOnly = true)
    public SellerDetails getSellerDetails() {
        Map<String, String> seller = settingRepository
                .findByNameIn(List.of(KEY_COMPANY_NAME, KEY_COMPANY_PHONE, KEY_COMPANY_ADDRESS)).stream()
                .filter(setting -> !setting.getValue().isBlank())
                .collect(Collectors.toMap(InvoicingSetting::getName, InvoicingSetting::getValue));
        return new SellerDetails(seller.get(KEY_COMPANY_NAME), seller.get(KEY_COMPANY_PHONE),
                seller.get(KEY_COMPANY_ADDRESS), currencySymbol);
    }

    @Transactional(readOnly = true)
    public SettingsResponse getSettings() {
        SellerDetails seller = getSellerDetails();
        return new SettingsResponse(seller.name(), seller.phone(), seller.address(), getGstRate(),
                seller.currencySymbol());
    }

    /**
     * Applies the non-null fields of the request. The GST rate is checked
     * before anything is written so a bad rate leaves the company details alone.
     */
    @Transactional
    public SettingsResponse applySettings(SettingsRequest request) {
        if (request.getGstRate() != null) {
            requireValidRate(request.getGstRate());
        }
        if (request.getCompanyName() != null) {
            updateSetting(KEY_COMPANY_NAME, request.getCompanyName().trim());
        }
        if (request.getCompanyPhone() != null) {
            updateSetting(KEY_COMPANY_PHONE, request.getCompanyPhone().trim());
        }
        if (request.getCompanyAddress() != null) {
            updateSetting(KEY_COMPANY_ADDRESS, request.getCompanyAddress().trim());
        }
        if (request.getGstRate() != null) {
            updateGstRate(request.getGstRate());
        }
        logger.info("Settings updated");
        return getSettings();
    }

    public String formatInvoiceNumber(long invoiceNumber) {
        return String.format("%s%05d", numberPrefix, invoiceNumber);
    }

    @Transactional
    public void updateGstRate(BigDecimal rate) {
        updateSetting(KEY_GST_RATE, requireValidRate(rate).toPlainString());
    }

    @Transactional
    public void updateSetting(String name, String value) {
        InvoicingSetting setting = settingRepository.findById(name)
                .orElseGet(() -> new InvoicingSetting(name, ""));
        setting.setValue(value != null ? value : "");
        settingRepository.save(setting);
    }

    private Optional<String> value(String name) {
        return settingRepository.findById(name)
                .map(InvoicingSetting::getValue)
                .filter(val -> !val.isBlank());
    }

    private static boolean isValidRate(BigDecimal rate) {
        return rate != null
                && rate.signum() >= 0
                && rate.compareTo(MAX_GST_RATE) <= 0
                && rate.stripTrailingZeros().scale() <= GST_RATE_SCALE;
    }

    private static BigDecimal requireValidRate(BigDecimal rate) {
        if (!isValidRate(rate)) {
            throw new ValidationException(ValidationFailure.INVALID_GST_RATE,
                    "GST rate must be between 0 and 100 percent with at most two decimals (got " + rate + ")");
        }
        return rate;
    }
}
