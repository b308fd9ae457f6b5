package changefeed.spi;

import changefeed.model.ProductInfo;

/**
 * Receives product info fetched after token acquisition. Parsing and storing the metadata
 * is the listener's business.
 */
@FunctionalInterface
public interface ProductInfoListener {

  ProductInfoListener NONE = info -> {
  };

  void onProductInfo(ProductInfo info);
}
